package uk.gegc.adaptivetest.features.session.application;

import uk.gegc.adaptivetest.features.pool.domain.model.Item;

import java.util.List;

public interface AbilityEstimator {

    /**
     * Re-estimates ability from the full response history, the newest response last.
     * Deterministic for identical inputs.
     *
     * @param priorTheta estimate before the newest response, used as the starting point
     */
    Estimate estimate(double priorTheta, List<ScoredItem> history);

    /**
     * {@code sqrt(1 / total information)} at theta, or positive infinity when no information is available.
     */
    double standardError(double theta, List<Item> items);

    record ScoredItem(Item item, boolean correct) {
    }

    record Estimate(double theta, double standardError, Method method, int iterations) {
    }

    enum Method {
        MAXIMUM_LIKELIHOOD,
        /**
         * Fixed step used while every response so far is correct, or every one incorrect.
         */
        DEGENERATE_STEP,
        /**
         * No responses yet; prior returned unchanged.
         */
        PRIOR
    }
}
