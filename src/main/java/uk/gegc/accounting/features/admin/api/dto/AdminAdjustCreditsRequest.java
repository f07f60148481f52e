package uk.gegc.accounting.features.admin.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

@Schema(name = "AdminAdjustCreditsRequest", description = "Add to or subtract from a user's balance")
public record AdminAdjustCreditsRequest(
        @Schema(description = "User id, username or email", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "User identifier is required")
        String identifier,

        @Schema(description = "Signed change; positive grants, negative deducts", example = "-50", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Delta is required")
        Long delta,

        @Schema(description = "Expiry of the grant when delta is positive")
        @PositiveOrZero(message = "Expiry days must be zero or positive")
        Integer expiryDays,

        @Size(max = 1000)
        String notes
) {}
