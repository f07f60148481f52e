package uk.gegc.accounting.features.credit.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.accounting.features.credit.application.CreditMetricsService;

/**
 * Micrometer-backed ledger metrics. Every increment is also logged at debug level.
 */
@Slf4j
@Service
public class CreditMetricsServiceImpl implements CreditMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter creditsDeductedCounter;
    private final Counter creditsRefundedCounter;
    private final Counter sessionsInitializedCounter;
    private final Counter sessionsRejectedCounter;
    private final Counter sessionsFinalizedCounter;
    private final Counter sessionsAbortedCounter;
    private final Counter creditsChargedCounter;
    private final Counter reconciliationRequiredCounter;
    private final Counter creditsUncollectedCounter;

    public CreditMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.creditsDeductedCounter = Counter.builder("credits.deducted")
                .description("Credits deducted from user allocations")
                .register(meterRegistry);
        this.creditsRefundedCounter = Counter.builder("credits.refunded")
                .description("Credits returned to users after settlement")
                .register(meterRegistry);
        this.sessionsInitializedCounter = Counter.builder("sessions.initialized")
                .description("Streaming sessions opened")
                .register(meterRegistry);
        this.sessionsRejectedCounter = Counter.builder("sessions.rejected")
                .description("Streaming sessions refused for insufficient credits")
                .register(meterRegistry);
        this.sessionsFinalizedCounter = Counter.builder("sessions.finalized")
                .description("Streaming sessions finalized")
                .register(meterRegistry);
        this.sessionsAbortedCounter = Counter.builder("sessions.aborted")
                .description("Streaming sessions aborted")
                .register(meterRegistry);
        this.creditsChargedCounter = Counter.builder("sessions.credits.charged")
                .description("Credits charged at session settlement")
                .register(meterRegistry);
        this.reconciliationRequiredCounter = Counter.builder("sessions.reconciliation.required")
                .description("Settlements whose actual cost could not be fully collected")
                .register(meterRegistry);
        this.creditsUncollectedCounter = Counter.builder("sessions.credits.uncollected")
                .description("Credits that could not be collected at settlement")
                .register(meterRegistry);
    }

    @Override
    public void incrementCreditsAllocated(String allocatedBy, long credits) {
        // Tagged by allocator, so registered lazily
        Counter.builder("credits.allocated")
                .description("Credits granted through allocations")
                .tag("allocatedBy", allocatedBy != null ? allocatedBy : "unknown")
                .register(meterRegistry)
                .increment(credits);
        log.debug("METRIC: credits.allocated allocatedBy={} credits={}", allocatedBy, credits);
    }

    @Override
    public void incrementCreditsDeducted(long credits) {
        creditsDeductedCounter.increment(credits);
        log.debug("METRIC: credits.deducted credits={}", credits);
    }

    @Override
    public void incrementCreditsRefunded(long credits) {
        creditsRefundedCounter.increment(credits);
        log.debug("METRIC: credits.refunded credits={}", credits);
    }

    @Override
    public void incrementSessionInitialized(long allocatedCredits) {
        sessionsInitializedCounter.increment();
        log.debug("METRIC: sessions.initialized allocated={}", allocatedCredits);
    }

    @Override
    public void incrementSessionRejected() {
        sessionsRejectedCounter.increment();
        log.debug("METRIC: sessions.rejected");
    }

    @Override
    public void incrementSessionFinalized(long chargedCredits) {
        sessionsFinalizedCounter.increment();
        creditsChargedCounter.increment(chargedCredits);
        log.debug("METRIC: sessions.finalized charged={}", chargedCredits);
    }

    @Override
    public void incrementSessionAborted(long chargedCredits) {
        sessionsAbortedCounter.increment();
        creditsChargedCounter.increment(chargedCredits);
        log.debug("METRIC: sessions.aborted charged={}", chargedCredits);
    }

    @Override
    public void incrementReconciliationRequired(long uncollectedCredits) {
        reconciliationRequiredCounter.increment();
        creditsUncollectedCounter.increment(uncollectedCredits);
        log.debug("METRIC: sessions.reconciliation.required uncollected={}", uncollectedCredits);
    }
}
