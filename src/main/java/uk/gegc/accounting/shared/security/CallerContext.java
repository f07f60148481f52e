package uk.gegc.accounting.shared.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import uk.gegc.accounting.features.account.domain.model.Capability;
import uk.gegc.accounting.shared.exception.ForbiddenException;
import uk.gegc.accounting.shared.exception.UnauthorizedException;

import java.util.Arrays;

/**
 * Reads the verified caller from the security context and evaluates capabilities.
 */
@Component
public class CallerContext {

    public AuthenticatedCaller currentCaller() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof AuthenticatedCaller caller)) {
            throw new UnauthorizedException("Authentication required");
        }
        return caller;
    }

    public boolean hasAnyCapability(Capability... capabilities) {
        AuthenticatedCaller caller = currentCaller();
        return Arrays.stream(capabilities).anyMatch(caller::hasCapability);
    }

    public boolean hasAllCapabilities(Capability... capabilities) {
        AuthenticatedCaller caller = currentCaller();
        return Arrays.stream(capabilities).allMatch(caller::hasCapability);
    }

    /**
     * Passes when the caller is acting on their own data or holds the given capability.
     */
    public void requireSelfOr(String targetUserId, Capability capability) {
        AuthenticatedCaller caller = currentCaller();
        if (caller.userId().equals(targetUserId) || caller.hasCapability(capability)) {
            return;
        }
        throw new ForbiddenException("Insufficient permissions to access another user's data");
    }
}
