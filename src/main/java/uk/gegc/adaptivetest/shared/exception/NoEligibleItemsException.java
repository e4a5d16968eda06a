package uk.gegc.adaptivetest.shared.exception;

import java.util.UUID;

/**
 * Thrown when no item can be selected for a session under its current constraints.
 * Callers are expected to complete the session in response.
 */
public class NoEligibleItemsException extends RuntimeException {

    private final UUID sessionId;

    public NoEligibleItemsException(UUID sessionId) {
        super("No eligible items left for session " + sessionId);
        this.sessionId = sessionId;
    }

    public UUID getSessionId() {
        return sessionId;
    }
}
