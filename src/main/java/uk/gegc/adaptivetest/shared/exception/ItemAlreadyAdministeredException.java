package uk.gegc.adaptivetest.shared.exception;

import java.util.UUID;

public class ItemAlreadyAdministeredException extends RuntimeException {

    public ItemAlreadyAdministeredException(UUID sessionId, String itemId) {
        super("Item " + itemId + " was already administered in session " + sessionId);
    }
}
