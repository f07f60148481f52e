package uk.gegc.accounting.features.admin.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.accounting.features.account.application.IdentityMirrorService;
import uk.gegc.accounting.features.account.domain.model.Capability;
import uk.gegc.accounting.features.admin.application.CreditAdministrationService;
import uk.gegc.accounting.features.credit.api.dto.BalanceChangeDto;
import uk.gegc.accounting.features.credit.api.dto.BalanceDto;
import uk.gegc.accounting.features.credit.api.dto.CreditAllocationDto;
import uk.gegc.accounting.features.credit.application.CreditLedgerService;
import uk.gegc.accounting.shared.exception.ForbiddenException;
import uk.gegc.accounting.shared.exception.InvalidAmountException;
import uk.gegc.accounting.shared.security.AuthenticatedCaller;

/**
 * Write operations run outside any transaction of their own so that each ledger call opens its
 * transaction with the user lock, after target resolution has finished.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditAdministrationServiceImpl implements CreditAdministrationService {

    private final IdentityMirrorService identityMirrorService;
    private final CreditLedgerService creditLedgerService;

    @Override
    public CreditAllocationDto allocate(AuthenticatedCaller actor, String identifier, long credits, Integer expiryDays, String notes) {
        requireCapability(actor, Capability.CREDITS_MANAGE);
        String userId = resolve(identifier);
        CreditAllocationDto allocation = creditLedgerService.allocate(userId, credits, actor.actorLabel(), expiryDays, notes);
        log.info("Admin {} allocated {} credits to user {}", actor.actorLabel(), credits, userId);
        return allocation;
    }

    @Override
    public BalanceChangeDto setAbsolute(AuthenticatedCaller actor, String identifier, long credits, Integer expiryDays, String notes) {
        requireCapability(actor, Capability.CREDITS_MANAGE);
        String userId = resolve(identifier);
        BalanceChangeDto change = creditLedgerService.setAbsolute(userId, credits, actor.actorLabel(), expiryDays, notes);
        log.info("Admin {} set balance of user {} from {} to {}",
                actor.actorLabel(), userId, change.previousBalance(), change.newBalance());
        return change;
    }

    @Override
    public BalanceChangeDto adjust(AuthenticatedCaller actor, String identifier, long delta, Integer expiryDays, String notes) {
        requireCapability(actor, Capability.CREDITS_MANAGE);
        String userId = resolve(identifier);
        BalanceChangeDto change = creditLedgerService.adjust(userId, delta, actor.actorLabel(), expiryDays, notes);
        log.info("Admin {} adjusted balance of user {} by {}", actor.actorLabel(), userId, delta);
        return change;
    }

    @Override
    public BalanceChangeDto remove(AuthenticatedCaller actor, String identifier, long credits) {
        requireCapability(actor, Capability.CREDITS_MANAGE);
        if (credits <= 0) {
            throw new InvalidAmountException("Credits to remove must be greater than zero");
        }
        String userId = resolve(identifier);
        // negative adjustment: same draw order as deduct, fails with InsufficientCreditsException
        BalanceChangeDto change = creditLedgerService.adjust(userId, Math.negateExact(credits), actor.actorLabel(), null, null);
        log.info("Admin {} removed {} credits from user {}", actor.actorLabel(), credits, userId);
        return change;
    }

    @Override
    @Transactional(readOnly = true)
    public BalanceDto getBalance(AuthenticatedCaller actor, String identifier) {
        requireCapability(actor, Capability.CREDITS_VIEW_ANY);
        return creditLedgerService.getBalance(resolve(identifier));
    }

    private String resolve(String identifier) {
        return identityMirrorService.resolveUser(identifier).getUserId();
    }

    private static void requireCapability(AuthenticatedCaller actor, Capability capability) {
        if (actor == null || !actor.hasCapability(capability)) {
            throw new ForbiddenException("Missing capability " + capability);
        }
    }
}
