package uk.gegc.accounting.features.pricing.application;

import uk.gegc.accounting.features.pricing.domain.model.TokenKind;

/**
 * Converts model token counts into credits. Implementations must be pure and deterministic:
 * streaming settlement prices the estimate and the actual count with the same function.
 */
public interface PricingFunction {

    long creditsFor(String modelId, long tokens, TokenKind kind);

    /**
     * Prices a combined input/output token count.
     */
    default long creditsFor(String modelId, long tokens) {
        return creditsFor(modelId, tokens, TokenKind.BOTH);
    }
}
