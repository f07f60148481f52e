package uk.gegc.accounting.features.streaming.domain.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;
import uk.gegc.accounting.features.streaming.domain.model.SessionStatus;

/**
 * A finalize or abort arrived for a session that is already terminal. Nothing was changed.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class SessionAlreadySettledException extends RuntimeException {

    private final SessionStatus status;

    public SessionAlreadySettledException(String sessionId, SessionStatus status) {
        super("Streaming session " + sessionId + " is already " + status.name().toLowerCase());
        this.status = status;
    }

    public SessionStatus getStatus() {
        return status;
    }
}
