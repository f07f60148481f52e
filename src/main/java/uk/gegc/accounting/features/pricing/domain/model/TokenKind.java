package uk.gegc.accounting.features.pricing.domain.model;

/**
 * Which side of a model call a token count belongs to.
 * {@code BOTH} splits the count evenly between input and output.
 */
public enum TokenKind {
    INPUT,
    OUTPUT,
    BOTH
}
