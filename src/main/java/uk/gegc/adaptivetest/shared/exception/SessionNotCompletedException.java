package uk.gegc.adaptivetest.shared.exception;

import java.util.UUID;

/**
 * Exception thrown when a report is requested for a session that has not been completed yet.
 */
public class SessionNotCompletedException extends InvalidStateTransitionException {

    public SessionNotCompletedException(UUID sessionId) {
        super(sessionId, "Session " + sessionId + " is not completed yet. Reports are only available for completed sessions.");
    }
}
