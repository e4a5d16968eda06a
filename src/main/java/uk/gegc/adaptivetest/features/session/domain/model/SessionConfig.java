package uk.gegc.adaptivetest.features.session.domain.model;

import lombok.Builder;

import java.time.Duration;
import java.util.Map;

/**
 * Per-session tuning of the adaptive loop.
 *
 * @param maxTime      optional wall-clock limit, {@code null} for none
 * @param topicTargets optional desired topic weights; empty means an even spread over the pool's topics
 */
@Builder(toBuilder = true)
public record SessionConfig(
        int maxQuestions,
        int minQuestions,
        double seThreshold,
        double initialAbility,
        boolean topicBalancing,
        boolean exposureControl,
        SelectionMethod selectionMethod,
        Duration maxTime,
        Map<String, Double> topicTargets
) {

    public SessionConfig {
        selectionMethod = selectionMethod == null ? SelectionMethod.MAXIMUM_INFORMATION : selectionMethod;
        topicTargets = topicTargets == null ? Map.of() : Map.copyOf(topicTargets);
    }
}
