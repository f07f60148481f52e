package uk.gegc.accounting.features.streaming.application;

import uk.gegc.accounting.features.streaming.api.dto.AbortResultDto;
import uk.gegc.accounting.features.streaming.api.dto.FinalizeResultDto;
import uk.gegc.accounting.features.streaming.api.dto.StreamingSessionDto;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Reserve-then-settle lifecycle for streaming calls: ACTIVE, then FINALIZED or ABORTED exactly once.
 */
public interface StreamingSessionService {

    /**
     * Prices the estimate, applies the safety factor and holds the result from the user's balance.
     *
     * @throws uk.gegc.accounting.features.streaming.domain.exception.InsufficientCreditsForSessionException when the hold cannot be covered; no session is created
     * @throws uk.gegc.accounting.features.streaming.domain.exception.SessionAlreadyExistsException when {@code sessionId} was used before
     */
    StreamingSessionDto initialize(String sessionId, String userId, String modelId, long estimatedTokens);

    /**
     * Charges the actual tokens and refunds the rest of the hold.
     *
     * @throws uk.gegc.accounting.features.streaming.domain.exception.SessionAlreadySettledException when the session is already terminal
     */
    FinalizeResultDto finalizeSession(String sessionId, String userId, long actualTokens, boolean success);

    /**
     * Charges the tokens generated before the abort and refunds the rest of the hold.
     */
    AbortResultDto abortSession(String sessionId, String userId, long tokensGenerated);

    List<StreamingSessionDto> getActiveSessions(String userId);

    List<StreamingSessionDto> getAllActiveSessions();

    /**
     * Active sessions plus those settled within the last {@code minutesAgo} minutes, newest first.
     *
     * @param minutesAgo {@code null} for the configured window
     */
    List<StreamingSessionDto> getRecentSessions(Integer minutesAgo);

    List<StreamingSessionDto> getRecentSessions(String userId, Integer minutesAgo);

    /**
     * Sessions still ACTIVE that were opened before {@code cutoff}.
     */
    List<StreamingSessionDto> findStaleSessions(LocalDateTime cutoff);
}
