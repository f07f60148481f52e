package uk.gegc.accounting.shared.security.aspect;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Before;
import org.springframework.stereotype.Component;
import uk.gegc.accounting.features.account.domain.model.Capability;
import uk.gegc.accounting.shared.exception.ForbiddenException;
import uk.gegc.accounting.shared.security.CallerContext;
import uk.gegc.accounting.shared.security.annotation.RequireCapability;

@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class CapabilityAspect {

    private final CallerContext callerContext;

    @Before("@annotation(requireCapability)")
    public void checkCapability(JoinPoint joinPoint, RequireCapability requireCapability) {
        Capability[] required = requireCapability.value();
        RequireCapability.LogicalOperator operator = requireCapability.operator();

        boolean hasAccess = operator == RequireCapability.LogicalOperator.AND
                ? callerContext.hasAllCapabilities(required)
                : callerContext.hasAnyCapability(required);

        if (!hasAccess) {
            log.warn("Access denied on {}: caller lacks capabilities {} ({})",
                    joinPoint.getSignature().toShortString(), required, operator);
            throw new ForbiddenException("Insufficient permissions to access this resource");
        }
    }
}
