package uk.gegc.adaptivetest.features.pool.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.adaptivetest.features.pool.domain.model.Item;
import uk.gegc.adaptivetest.features.pool.domain.model.ItemType;
import uk.gegc.adaptivetest.shared.exception.InvalidItemParametersException;

/**
 * Per-type validation and scoring of items.
 */
public abstract class ItemHandler {

    /**
     * Returns the item type that this handler supports
     * @return the supported item type
     */
    public abstract ItemType supportedType();

    /**
     * Checks that the option set and correct answer fit the item type.
     */
    public abstract void validate(Item item) throws InvalidItemParametersException;

    public boolean score(Item item, JsonNode answer) {
        if (item.type() != supportedType()) {
            throw new IllegalArgumentException("Handler for " + supportedType() + " cannot score " + item.type() + " item " + item.id());
        }
        if (answer == null || answer.isNull() || answer.isMissingNode()) {
            return false;
        }
        return doScore(item, answer);
    }

    protected abstract boolean doScore(Item item, JsonNode answer);
}
