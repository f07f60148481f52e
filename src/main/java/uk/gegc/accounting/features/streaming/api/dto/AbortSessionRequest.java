package uk.gegc.accounting.features.streaming.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

@Schema(name = "AbortSessionRequest", description = "Settle a session that ended without completing")
public record AbortSessionRequest(
        @Schema(example = "chat-7f2c91", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Session id is required")
        String sessionId,

        @Schema(description = "Tokens produced before the abort; defaults to 0", example = "800")
        @PositiveOrZero(message = "Tokens generated must be zero or positive")
        Long tokensGenerated
) {}
