package uk.gegc.adaptivetest.shared.exception;

import java.util.UUID;

/**
 * Thrown when a session is saved from a stale snapshot, i.e. another call
 * changed the session in between.
 */
public class SessionConcurrencyException extends RuntimeException {

    public SessionConcurrencyException(UUID sessionId, long expectedVersion, long actualVersion) {
        super("Session " + sessionId + " was modified concurrently (expected version "
                + expectedVersion + ", found " + actualVersion + ")");
    }
}
