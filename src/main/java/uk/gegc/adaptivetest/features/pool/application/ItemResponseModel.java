package uk.gegc.adaptivetest.features.pool.application;

import uk.gegc.adaptivetest.features.pool.domain.model.Item;

public interface ItemResponseModel {

    /**
     * Probability of a correct response at ability {@code theta}. Strictly increasing in theta.
     */
    double probability(double theta, Item item);

    /**
     * Fisher information the item carries about ability at {@code theta}; never negative.
     */
    double information(double theta, Item item);
}
