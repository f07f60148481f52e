package uk.gegc.accounting.features.admin.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

@Schema(name = "AdminSetCreditsRequest", description = "Replace a user's balance with an exact amount")
public record AdminSetCreditsRequest(
        @Schema(description = "User id, username or email", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "User identifier is required")
        String identifier,

        @Schema(description = "New balance", example = "1000", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Credits are required")
        @PositiveOrZero(message = "Credits must be zero or positive")
        Long credits,

        @PositiveOrZero(message = "Expiry days must be zero or positive")
        Integer expiryDays,

        @Size(max = 1000)
        String notes
) {}
