package uk.gegc.adaptivetest.features.session.application;

import uk.gegc.adaptivetest.features.pool.domain.model.Item;
import uk.gegc.adaptivetest.features.pool.domain.model.QuestionPool;
import uk.gegc.adaptivetest.features.session.domain.model.AdaptiveSession;

import java.util.List;
import java.util.Optional;

public interface ItemSelector {

    /**
     * Picks the best eligible item for the session. Exposure is recorded separately through
     * {@link #recordExposure} once the selection has been stored.
     *
     * @return empty when no unadministered item is left
     */
    Optional<Item> selectNext(AdaptiveSession session, QuestionPool pool);

    /**
     * Counts one exposure of the issued item in the pool.
     */
    void recordExposure(AdaptiveSession session, QuestionPool pool, Item item);

    /**
     * Eligible items, best first. Has no side effects.
     */
    List<RankedItem> rankCandidates(AdaptiveSession session, QuestionPool pool);

    default boolean hasCandidates(AdaptiveSession session, QuestionPool pool) {
        return !rankCandidates(session, pool).isEmpty();
    }

    /**
     * @param criterion raw selection criterion at the current theta
     * @param score     criterion after topic balancing
     */
    record RankedItem(Item item, double criterion, double score) {
    }
}
