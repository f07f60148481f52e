package uk.gegc.accounting.features.streaming.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

@Schema(name = "FinalizeSessionRequest", description = "Settle a session with the tokens actually used")
public record FinalizeSessionRequest(
        @Schema(example = "chat-7f2c91", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Session id is required")
        String sessionId,

        @Schema(example = "3150", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Actual tokens are required")
        @PositiveOrZero(message = "Actual tokens must be zero or positive")
        Long actualTokens,

        @Schema(description = "Whether the call completed successfully; defaults to true")
        Boolean success
) {}
