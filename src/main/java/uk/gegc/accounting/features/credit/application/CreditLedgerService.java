package uk.gegc.accounting.features.credit.application;

import uk.gegc.accounting.features.credit.api.dto.BalanceChangeDto;
import uk.gegc.accounting.features.credit.api.dto.BalanceDto;
import uk.gegc.accounting.features.credit.api.dto.CreditAllocationDto;
import uk.gegc.accounting.features.credit.domain.model.AllocationDraw;

import java.util.List;
import java.util.Optional;

/**
 * Per-user credit allocations and the balance derived from them.
 * Balance is always the sum of remaining credits over unexpired allocations.
 */
public interface CreditLedgerService {

    BalanceDto getBalance(String userId);

    long currentBalance(String userId);

    /**
     * @param required non-negative; zero is always affordable
     */
    boolean hasSufficientCredits(String userId, long required);

    /**
     * Grants {@code credits} in a new allocation, creating the mirror account when absent.
     *
     * @param expiryDays {@code null} for the configured default, {@code 0} for no expiry
     */
    CreditAllocationDto allocate(String userId, long credits, String allocatedBy, Integer expiryDays, String notes);

    /**
     * Atomically removes {@code credits} from the user's active allocations, soonest-expiring first.
     *
     * @return {@code false}, with nothing changed, when the balance is lower than {@code credits}
     */
    boolean deduct(String userId, long credits);

    BalanceChangeDto setAbsolute(String userId, long credits, String setBy, Integer expiryDays, String notes);

    /**
     * Positive deltas allocate, negative deltas deduct.
     *
     * @throws uk.gegc.accounting.features.credit.domain.exception.InsufficientCreditsException when a negative delta exceeds the balance
     */
    BalanceChangeDto adjust(String userId, long delta, String adjustedBy, Integer expiryDays, String notes);

    /**
     * Same check-and-deduct as {@link #deduct} but reports which allocations were drawn from,
     * so a later {@link #refund} can put credits back where they came from.
     */
    Optional<List<AllocationDraw>> reserve(String userId, long credits);

    /**
     * Returns {@code credits} to the user. Draws are restored latest first while their allocation is
     * unexpired and below its total; the remainder lands in a new refund allocation.
     *
     * @return credits refunded
     */
    long refund(String userId, List<AllocationDraw> draws, long credits, String notes);

    List<CreditAllocationDto> listAllocations(String userId);
}
