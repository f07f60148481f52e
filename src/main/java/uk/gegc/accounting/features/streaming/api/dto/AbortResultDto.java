package uk.gegc.accounting.features.streaming.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.accounting.features.streaming.domain.model.SessionStatus;

import java.util.UUID;

@Schema(name = "AbortResultDto", description = "Outcome of aborting a streaming session")
public record AbortResultDto(
        String sessionId,
        SessionStatus status,
        long allocatedCredits,
        @Schema(description = "Price of the tokens generated before the abort")
        long partialCredits,
        long chargedCredits,
        long refund,
        long uncollectedCredits,
        boolean reconciliationRequired,
        UUID usageRecordId
) {}
