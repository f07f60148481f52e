package uk.gegc.accounting.features.credit.domain.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Raised when the user's balance cannot cover a deduction. Not retried automatically.
 */
@ResponseStatus(HttpStatus.PAYMENT_REQUIRED)
public class InsufficientCreditsException extends RuntimeException {

    private final long balance;
    private final long required;

    public InsufficientCreditsException(long balance, long required) {
        super(String.format("Insufficient credits: required %d, available %d", required, balance));
        this.balance = balance;
        this.required = required;
    }

    public long getBalance() {
        return balance;
    }

    public long getRequired() {
        return required;
    }

    public long getShortfall() {
        return Math.max(0L, required - balance);
    }
}
