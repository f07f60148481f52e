package uk.gegc.accounting.features.admin.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@Schema(name = "AdminRemoveCreditsRequest", description = "Deduct credits from a user")
public record AdminRemoveCreditsRequest(
        @Schema(description = "User id, username or email", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "User identifier is required")
        String identifier,

        @Schema(example = "100", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Credits are required")
        @Positive(message = "Credits must be greater than zero")
        Long credits
) {}
