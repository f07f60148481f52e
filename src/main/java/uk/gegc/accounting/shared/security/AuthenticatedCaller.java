package uk.gegc.accounting.shared.security;

import uk.gegc.accounting.features.account.domain.model.AccountRole;
import uk.gegc.accounting.features.account.domain.model.Capability;

/**
 * Principal placed in the security context once the identity token has been verified.
 */
public record AuthenticatedCaller(
        String userId,
        String username,
        String email,
        AccountRole role
) {

    public boolean hasCapability(Capability capability) {
        return role != null && role.grants(capability);
    }

    /**
     * Label recorded as {@code allocatedBy} on allocations the caller creates.
     */
    public String actorLabel() {
        return username != null ? username : userId;
    }
}
