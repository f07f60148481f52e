package uk.gegc.accounting.features.credit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import uk.gegc.accounting.features.pricing.domain.model.TokenKind;

@Schema(name = "CalculateCreditsRequest", description = "Price a token count for a model")
public record CalculateCreditsRequest(
        @Schema(example = "amazon.nova-lite-v1:0", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Model id is required")
        String modelId,

        @Schema(example = "2500", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Token count is required")
        @PositiveOrZero(message = "Token count must be zero or positive")
        Long tokens,

        @Schema(description = "Side of the call the tokens belong to; defaults to BOTH")
        TokenKind tokenKind
) {}
