package uk.gegc.accounting.features.streaming.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.accounting.features.streaming.domain.model.SessionStatus;

import java.util.UUID;

@Schema(name = "FinalizeResultDto", description = "Outcome of finalizing a streaming session")
public record FinalizeResultDto(
        String sessionId,
        SessionStatus status,
        long allocatedCredits,
        @Schema(description = "Price of the tokens actually used")
        long actualCredits,
        @Schema(description = "Credits taken from the user; below actualCredits only when the shortfall could not be collected")
        long chargedCredits,
        @Schema(description = "Credits returned to the user")
        long refund,
        long uncollectedCredits,
        boolean reconciliationRequired,
        UUID usageRecordId
) {}
