package uk.gegc.accounting.features.credit.api.dto;

import uk.gegc.accounting.features.pricing.domain.model.TokenKind;

public record CalculateCreditsResponse(
        String modelId,
        long tokens,
        TokenKind tokenKind,
        long credits
) {}
