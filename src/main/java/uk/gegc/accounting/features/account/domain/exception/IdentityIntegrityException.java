package uk.gegc.accounting.features.account.domain.exception;

/**
 * Raised when one identifier resolves to more than one account.
 * Username and email are unique, so this indicates corrupted mirror data.
 */
public class IdentityIntegrityException extends RuntimeException {
    public IdentityIntegrityException(String message) {
        super(message);
    }
}
