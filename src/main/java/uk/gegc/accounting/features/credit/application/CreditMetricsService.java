package uk.gegc.accounting.features.credit.application;

/**
 * Counters for ledger and streaming session activity.
 */
public interface CreditMetricsService {

    void incrementCreditsAllocated(String allocatedBy, long credits);

    void incrementCreditsDeducted(long credits);

    void incrementCreditsRefunded(long credits);

    void incrementSessionInitialized(long allocatedCredits);

    void incrementSessionRejected();

    void incrementSessionFinalized(long chargedCredits);

    void incrementSessionAborted(long chargedCredits);

    void incrementReconciliationRequired(long uncollectedCredits);
}
