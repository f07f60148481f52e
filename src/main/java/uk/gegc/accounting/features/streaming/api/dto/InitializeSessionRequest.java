package uk.gegc.accounting.features.streaming.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

@Schema(name = "InitializeSessionRequest", description = "Open a streaming session and hold credits for it")
public record InitializeSessionRequest(
        @Schema(description = "Caller-generated unique id", example = "chat-7f2c91", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Session id is required")
        @Size(max = 128, message = "Session id must be at most 128 characters")
        String sessionId,

        @Schema(example = "amazon.nova-lite-v1:0", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Model id is required")
        @Size(max = 200)
        String modelId,

        @Schema(description = "Expected input plus output tokens", example = "4000", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Estimated tokens are required")
        @Positive(message = "Estimated tokens must be greater than zero")
        Long estimatedTokens
) {}
