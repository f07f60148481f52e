package uk.gegc.accounting.features.usage.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.Map;

@Schema(name = "RecordUsageRequest", description = "Record usage of a metered operation for the caller")
public record RecordUsageRequest(
        @Schema(example = "chat", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Service is required")
        @Size(max = 100)
        String service,

        @Schema(example = "amazon.nova-lite-v1:0", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Operation is required")
        @Size(max = 200)
        String operation,

        @Schema(description = "Credits consumed; zero-cost operations may be recorded", example = "12", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Credits are required")
        @PositiveOrZero(message = "Credits must be zero or positive")
        Long credits,

        Map<String, Object> metadata
) {}
