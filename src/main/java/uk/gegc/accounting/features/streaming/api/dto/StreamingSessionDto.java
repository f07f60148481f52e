package uk.gegc.accounting.features.streaming.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.accounting.features.streaming.domain.model.SessionStatus;

import java.time.LocalDateTime;

@Schema(name = "StreamingSessionDto", description = "A streaming session and its hold")
public record StreamingSessionDto(
        String sessionId,
        String userId,
        String modelId,
        long estimatedTokens,
        long estimatedCredits,
        @Schema(description = "Credits held when the session was opened")
        long allocatedCredits,
        SessionStatus status,
        Long actualTokens,
        Long actualCredits,
        Long chargedCredits,
        Long refundedCredits,
        long uncollectedCredits,
        boolean reconciliationRequired,
        Boolean succeeded,
        LocalDateTime createdAt,
        LocalDateTime settledAt
) {}
