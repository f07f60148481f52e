package uk.gegc.accounting.features.credit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.Map;

@Schema(name = "DeductCreditsRequest", description = "Charge the caller for a completed synchronous operation")
public record DeductCreditsRequest(
        @Schema(example = "25", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Credits are required")
        @Positive(message = "Credits must be greater than zero")
        Long credits,

        @Schema(example = "chat", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Service is required")
        @Size(max = 100)
        String service,

        @Schema(example = "amazon.nova-micro-v1:0", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Operation is required")
        @Size(max = 200)
        String operation,

        Map<String, Object> metadata
) {}
