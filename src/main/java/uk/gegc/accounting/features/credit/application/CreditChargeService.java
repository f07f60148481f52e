package uk.gegc.accounting.features.credit.application;

import uk.gegc.accounting.features.credit.api.dto.ChargeResultDto;

import java.util.Map;

/**
 * Synchronous metered operations: deduct and record usage in one transaction.
 */
public interface CreditChargeService {

    /**
     * @throws uk.gegc.accounting.features.credit.domain.exception.InsufficientCreditsException when the balance cannot cover {@code credits}
     */
    ChargeResultDto charge(String userId, long credits, String service, String operation, Map<String, Object> metadata);
}
