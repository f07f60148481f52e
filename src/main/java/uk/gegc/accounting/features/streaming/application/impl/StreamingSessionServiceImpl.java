package uk.gegc.accounting.features.streaming.application.impl;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;
import uk.gegc.accounting.features.credit.application.CreditLedgerService;
import uk.gegc.accounting.features.credit.application.CreditMetricsService;
import uk.gegc.accounting.features.credit.application.LedgerStructuredLogger;
import uk.gegc.accounting.features.credit.application.UserLedgerLock;
import uk.gegc.accounting.features.credit.domain.model.AllocationDraw;
import uk.gegc.accounting.features.pricing.application.PricingFunction;
import uk.gegc.accounting.features.streaming.api.dto.AbortResultDto;
import uk.gegc.accounting.features.streaming.api.dto.FinalizeResultDto;
import uk.gegc.accounting.features.streaming.api.dto.StreamingSessionDto;
import uk.gegc.accounting.features.streaming.application.StreamingProperties;
import uk.gegc.accounting.features.streaming.application.StreamingSessionService;
import uk.gegc.accounting.features.streaming.domain.exception.InsufficientCreditsForSessionException;
import uk.gegc.accounting.features.streaming.domain.exception.SessionAlreadyExistsException;
import uk.gegc.accounting.features.streaming.domain.exception.SessionAlreadySettledException;
import uk.gegc.accounting.features.streaming.domain.exception.SessionNotFoundException;
import uk.gegc.accounting.features.streaming.domain.model.SessionHold;
import uk.gegc.accounting.features.streaming.domain.model.SessionStatus;
import uk.gegc.accounting.features.streaming.domain.model.StreamingSession;
import uk.gegc.accounting.features.streaming.infra.mapping.StreamingSessionMapper;
import uk.gegc.accounting.features.streaming.infra.repository.SessionHoldRepository;
import uk.gegc.accounting.features.streaming.infra.repository.StreamingSessionRepository;
import uk.gegc.accounting.features.usage.api.dto.UsageRecordDto;
import uk.gegc.accounting.features.usage.application.UsageRecorderService;
import uk.gegc.accounting.shared.exception.InvalidAmountException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@Validated
@RequiredArgsConstructor
public class StreamingSessionServiceImpl implements StreamingSessionService {

    private static final Logger log = LoggerFactory.getLogger(StreamingSessionServiceImpl.class);

    private final StreamingSessionRepository sessionRepository;
    private final SessionHoldRepository holdRepository;
    private final StreamingSessionMapper sessionMapper;
    private final CreditLedgerService creditLedgerService;
    private final UserLedgerLock ledgerLock;
    private final UsageRecorderService usageRecorderService;
    private final PricingFunction pricingFunction;
    private final StreamingProperties streamingProperties;
    private final CreditMetricsService metricsService;
    private final Clock clock;

    @Override
    @Transactional
    public StreamingSessionDto initialize(String sessionId, String userId, String modelId, long estimatedTokens) {
        requireText(sessionId, "sessionId");
        requireText(modelId, "modelId");
        if (estimatedTokens <= 0) {
            throw new InvalidAmountException("Estimated tokens must be greater than zero");
        }

        long estimatedCredits = pricingFunction.creditsFor(modelId, estimatedTokens);
        long allocatedCredits = applySafetyFactor(estimatedCredits);

        ledgerLock.lockExisting(userId);
        if (sessionRepository.existsBySessionId(sessionId)) {
            throw new SessionAlreadyExistsException(sessionId);
        }

        List<AllocationDraw> draws = List.of();
        if (allocatedCredits > 0) {
            draws = creditLedgerService.reserve(userId, allocatedCredits).orElseThrow(() -> {
                long balance = creditLedgerService.currentBalance(userId);
                metricsService.incrementSessionRejected();
                log.info("Streaming session {} refused for user {}: needs {} credits, has {}",
                        sessionId, userId, allocatedCredits, balance);
                return new InsufficientCreditsForSessionException(balance, allocatedCredits);
            });
        }

        StreamingSession session = new StreamingSession();
        session.setSessionId(sessionId);
        session.setUserId(userId);
        session.setModelId(modelId);
        session.setEstimatedTokens(estimatedTokens);
        session.setEstimatedCredits(estimatedCredits);
        session.setAllocatedCredits(allocatedCredits);
        session.setStatus(SessionStatus.ACTIVE);
        session.setCreatedAt(LocalDateTime.now(clock));
        StreamingSession saved;
        try {
            saved = sessionRepository.saveAndFlush(session);
        } catch (DataIntegrityViolationException ex) {
            // another user's initialize claimed the same id first
            log.info("Streaming session {} lost the insert race for user {}", sessionId, userId);
            throw new SessionAlreadyExistsException(sessionId);
        }

        List<SessionHold> holds = new ArrayList<>();
        for (int i = 0; i < draws.size(); i++) {
            AllocationDraw draw = draws.get(i);
            SessionHold hold = new SessionHold();
            hold.setSessionId(sessionId);
            hold.setAllocationId(draw.allocationId());
            hold.setCredits(draw.credits());
            hold.setDrawOrder(i);
            holds.add(hold);
        }
        holdRepository.saveAll(holds);

        metricsService.incrementSessionInitialized(allocatedCredits);
        log.info("Opened streaming session {} for user {} on {}: estimated {} tokens, holding {} credits",
                sessionId, userId, modelId, estimatedTokens, allocatedCredits);
        return sessionMapper.toDto(saved);
    }

    @Override
    @Transactional
    public FinalizeResultDto finalizeSession(String sessionId, String userId, long actualTokens, boolean success) {
        if (actualTokens < 0) {
            throw new InvalidAmountException("Actual tokens must be zero or positive");
        }
        StreamingSession session = lockActiveSession(sessionId, userId);
        Settlement settlement = settle(session, actualTokens, SessionStatus.FINALIZED, success,
                streamingProperties.getFinalizeService());
        metricsService.incrementSessionFinalized(settlement.chargedCredits());

        return new FinalizeResultDto(
                sessionId,
                SessionStatus.FINALIZED,
                session.getAllocatedCredits(),
                settlement.actualCredits(),
                settlement.chargedCredits(),
                settlement.refund(),
                settlement.uncollectedCredits(),
                settlement.reconciliationRequired(),
                settlement.usageRecordId()
        );
    }

    @Override
    @Transactional
    public AbortResultDto abortSession(String sessionId, String userId, long tokensGenerated) {
        if (tokensGenerated < 0) {
            throw new InvalidAmountException("Tokens generated must be zero or positive");
        }
        StreamingSession session = lockActiveSession(sessionId, userId);
        Settlement settlement = settle(session, tokensGenerated, SessionStatus.ABORTED, false,
                streamingProperties.getAbortService());
        metricsService.incrementSessionAborted(settlement.chargedCredits());

        return new AbortResultDto(
                sessionId,
                SessionStatus.ABORTED,
                session.getAllocatedCredits(),
                settlement.actualCredits(),
                settlement.chargedCredits(),
                settlement.refund(),
                settlement.uncollectedCredits(),
                settlement.reconciliationRequired(),
                settlement.usageRecordId()
        );
    }

    @Override
    @Transactional(readOnly = true)
    public List<StreamingSessionDto> getActiveSessions(String userId) {
        return sessionMapper.toDtos(
                sessionRepository.findByUserIdAndStatusOrderByCreatedAtDesc(userId, SessionStatus.ACTIVE));
    }

    @Override
    @Transactional(readOnly = true)
    public List<StreamingSessionDto> getAllActiveSessions() {
        return sessionMapper.toDtos(sessionRepository.findByStatusOrderByCreatedAtDesc(SessionStatus.ACTIVE));
    }

    @Override
    @Transactional(readOnly = true)
    public List<StreamingSessionDto> getRecentSessions(Integer minutesAgo) {
        LocalDateTime since = windowStart(minutesAgo);
        return sessionMapper.toDtos(sessionRepository.findRecent(
                SessionStatus.ACTIVE, since, PageRequest.of(0, streamingProperties.getRecentLimit())));
    }

    @Override
    @Transactional(readOnly = true)
    public List<StreamingSessionDto> getRecentSessions(String userId, Integer minutesAgo) {
        LocalDateTime since = windowStart(minutesAgo);
        return sessionMapper.toDtos(sessionRepository.findRecentByUserId(
                userId, SessionStatus.ACTIVE, since, PageRequest.of(0, streamingProperties.getUserRecentLimit())));
    }

    @Override
    @Transactional(readOnly = true)
    public List<StreamingSessionDto> findStaleSessions(LocalDateTime cutoff) {
        return sessionMapper.toDtos(sessionRepository.findByStatusAndCreatedAtBefore(SessionStatus.ACTIVE, cutoff));
    }

    /**
     * Locks the owner's ledger, then the session row. Sessions owned by someone else are reported
     * as missing.
     */
    private StreamingSession lockActiveSession(String sessionId, String userId) {
        requireText(sessionId, "sessionId");
        if (ledgerLock.lock(userId).isEmpty()) {
            throw new SessionNotFoundException(sessionId);
        }
        StreamingSession session = sessionRepository.findBySessionIdForUpdate(sessionId)
                .filter(s -> s.getUserId().equals(userId))
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (session.getStatus().isTerminal()) {
            log.warn("Rejected settlement of streaming session {}: already {}", sessionId, session.getStatus());
            throw new SessionAlreadySettledException(sessionId, session.getStatus());
        }
        return session;
    }

    /**
     * Reconciles the hold against the priced usage.
     *
     * <p>Cost within the hold: the difference is refunded. Cost above the hold: the shortfall is
     * deducted separately; if the balance cannot cover it the charge is capped at the hold and the
     * session is flagged for reconciliation.
     */
    private Settlement settle(StreamingSession session, long tokens, SessionStatus outcome, boolean success, String service) {
        String sessionId = session.getSessionId();
        String userId = session.getUserId();
        long allocated = session.getAllocatedCredits();
        long actual = pricingFunction.creditsFor(session.getModelId(), tokens);

        long charged;
        long refund = 0L;
        long uncollected = 0L;
        if (actual <= allocated) {
            charged = actual;
            refund = allocated - actual;
        } else {
            long shortfall = actual - allocated;
            if (creditLedgerService.deduct(userId, shortfall)) {
                charged = actual;
            } else {
                charged = allocated;
                uncollected = shortfall;
                metricsService.incrementReconciliationRequired(shortfall);
                log.warn("Streaming session {} of user {} cost {} credits but only {} could be collected; flagged for reconciliation",
                        sessionId, userId, actual, allocated);
            }
        }

        if (refund > 0) {
            List<AllocationDraw> draws = holdRepository.findBySessionIdOrderByDrawOrderAsc(sessionId).stream()
                    .map(hold -> new AllocationDraw(hold.getAllocationId(), hold.getCredits()))
                    .toList();
            creditLedgerService.refund(userId, draws, refund, "Refund from streaming session " + sessionId);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        session.setStatus(outcome);
        session.setSettledAt(now);
        session.setActualTokens(tokens);
        session.setActualCredits(actual);
        session.setChargedCredits(charged);
        session.setRefundedCredits(refund);
        session.setUncollectedCredits(uncollected);
        session.setReconciliationRequired(uncollected > 0);
        session.setSucceeded(success);
        sessionRepository.save(session);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sessionId", sessionId);
        metadata.put("estimatedTokens", session.getEstimatedTokens());
        metadata.put(outcome == SessionStatus.ABORTED ? "tokensGenerated" : "actualTokens", tokens);
        metadata.put("allocatedCredits", allocated);
        metadata.put("actualCredits", actual);
        metadata.put("refund", refund);
        metadata.put("durationSeconds", Duration.between(session.getCreatedAt(), now).toSeconds());
        metadata.put("success", success);
        if (uncollected > 0) {
            metadata.put("uncollectedCredits", uncollected);
        }
        UsageRecordDto usage = usageRecorderService.record(userId, service, session.getModelId(), charged, metadata);

        LedgerStructuredLogger.logSettlement(log, uncollected > 0 ? "warn" : "info",
                "Settled streaming session {} as {}: charged {}, refunded {}",
                userId, sessionId, outcome.name(), allocated, charged, refund,
                sessionId, outcome, charged, refund);
        return new Settlement(actual, charged, refund, uncollected, uncollected > 0, usage.id());
    }

    private long applySafetyFactor(long estimatedCredits) {
        return BigDecimal.valueOf(estimatedCredits)
                .multiply(BigDecimal.valueOf(streamingProperties.getSafetyFactor()))
                .setScale(0, RoundingMode.CEILING)
                .longValueExact();
    }

    private LocalDateTime windowStart(Integer minutesAgo) {
        int minutes = minutesAgo != null ? minutesAgo : streamingProperties.getRecentWindowMinutes();
        if (minutes <= 0) {
            throw new IllegalArgumentException("minutesAgo must be greater than zero");
        }
        return LocalDateTime.now(clock).minusMinutes(minutes);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    private record Settlement(
            long actualCredits,
            long chargedCredits,
            long refund,
            long uncollectedCredits,
            boolean reconciliationRequired,
            UUID usageRecordId
    ) {}
}
