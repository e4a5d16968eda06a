package uk.gegc.adaptivetest.features.pool.application;

import uk.gegc.adaptivetest.features.pool.domain.model.Item;
import uk.gegc.adaptivetest.features.pool.domain.model.ItemStatistics;
import uk.gegc.adaptivetest.features.pool.domain.model.QuestionPool;

import java.util.UUID;

public interface QuestionPoolService {

    QuestionPool createPool(String tenantId, String name, String subject);

    /**
     * Validates the item against its type and IRT parameter ranges and appends it to the pool.
     *
     * @throws uk.gegc.adaptivetest.shared.exception.InvalidItemParametersException if the item is rejected
     */
    Item addItem(UUID poolId, Item item);

    QuestionPool getPool(UUID poolId);

    Item getItem(UUID poolId, String itemId);

    ItemStatistics getItemStatistics(UUID poolId, String itemId);
}
