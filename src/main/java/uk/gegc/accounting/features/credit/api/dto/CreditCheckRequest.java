package uk.gegc.accounting.features.credit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

@Schema(name = "CreditCheckRequest", description = "Ask whether the caller can afford an operation")
public record CreditCheckRequest(
        @Schema(description = "Credits the operation needs", example = "120", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Required credits must be provided")
        @PositiveOrZero(message = "Required credits must be zero or positive")
        Long requiredCredits
) {}
