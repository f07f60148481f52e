package uk.gegc.accounting.features.admin.application;

import uk.gegc.accounting.features.credit.api.dto.BalanceChangeDto;
import uk.gegc.accounting.features.credit.api.dto.BalanceDto;
import uk.gegc.accounting.features.credit.api.dto.CreditAllocationDto;
import uk.gegc.accounting.shared.security.AuthenticatedCaller;

/**
 * Privileged ledger operations on other users' balances.
 *
 * <p>Every method checks the acting caller's capabilities and resolves {@code identifier}
 * (id, username or email) to an existing account before touching the ledger. Unknown targets
 * fail with {@link uk.gegc.accounting.features.account.domain.exception.UserNotFoundException};
 * accounts are never created here.
 */
public interface CreditAdministrationService {

    CreditAllocationDto allocate(AuthenticatedCaller actor, String identifier, long credits, Integer expiryDays, String notes);

    BalanceChangeDto setAbsolute(AuthenticatedCaller actor, String identifier, long credits, Integer expiryDays, String notes);

    BalanceChangeDto adjust(AuthenticatedCaller actor, String identifier, long delta, Integer expiryDays, String notes);

    /**
     * @throws uk.gegc.accounting.features.credit.domain.exception.InsufficientCreditsException when the balance is lower than {@code credits}
     */
    BalanceChangeDto remove(AuthenticatedCaller actor, String identifier, long credits);

    BalanceDto getBalance(AuthenticatedCaller actor, String identifier);
}
