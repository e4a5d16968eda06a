package uk.gegc.adaptivetest.shared.exception;

import java.util.UUID;

public class InvalidStateTransitionException extends RuntimeException {

    private final UUID sessionId;

    public InvalidStateTransitionException(UUID sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public UUID getSessionId() {
        return sessionId;
    }
}
