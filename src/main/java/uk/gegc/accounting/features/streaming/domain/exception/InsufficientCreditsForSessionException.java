package uk.gegc.accounting.features.streaming.domain.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.PAYMENT_REQUIRED)
public class InsufficientCreditsForSessionException extends RuntimeException {

    private final long balance;
    private final long required;

    public InsufficientCreditsForSessionException(long balance, long required) {
        super(String.format("Insufficient credits to start streaming session: required %d, available %d", required, balance));
        this.balance = balance;
        this.required = required;
    }

    public long getBalance() {
        return balance;
    }

    public long getRequired() {
        return required;
    }
}
