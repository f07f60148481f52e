package uk.gegc.accounting.features.streaming.domain.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class SessionAlreadyExistsException extends RuntimeException {
    public SessionAlreadyExistsException(String sessionId) {
        super("Streaming session already exists: " + sessionId);
    }
}
