package uk.gegc.adaptivetest.shared.exception;

/**
 * Thrown at pool authoring time when an item carries IRT parameters outside
 * their valid ranges, misses a required field, or declares an option set that
 * does not fit its type.
 */
public class InvalidItemParametersException extends RuntimeException {

    private final String itemId;

    public InvalidItemParametersException(String itemId, String message) {
        super(itemId == null ? message : "Item " + itemId + ": " + message);
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}
