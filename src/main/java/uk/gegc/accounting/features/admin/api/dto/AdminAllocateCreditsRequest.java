package uk.gegc.accounting.features.admin.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

@Schema(name = "AdminAllocateCreditsRequest", description = "Grant credits to a user")
public record AdminAllocateCreditsRequest(
        @Schema(description = "User id, username or email", example = "jdoe@example.com", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "User identifier is required")
        String identifier,

        @Schema(example = "500", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Credits are required")
        @Positive(message = "Credits must be greater than zero")
        Long credits,

        @Schema(description = "Days until the grant expires; omitted for the default, 0 for never", example = "30")
        @PositiveOrZero(message = "Expiry days must be zero or positive")
        Integer expiryDays,

        @Size(max = 1000)
        String notes
) {}
