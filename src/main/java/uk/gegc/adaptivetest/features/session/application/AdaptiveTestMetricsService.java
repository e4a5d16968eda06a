package uk.gegc.adaptivetest.features.session.application;

import uk.gegc.adaptivetest.features.session.domain.model.StopReason;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Operational metrics for the adaptive testing loop.
 */
public interface AdaptiveTestMetricsService {

    void incrementSessionStarted(UUID sessionId, UUID poolId);

    void incrementSessionCompleted(UUID sessionId, StopReason reason, int questionsAnswered);

    void incrementSessionAbandoned(UUID sessionId, int questionsAnswered);

    void incrementResponseRecorded(UUID sessionId, boolean correct);

    void incrementItemExposed(UUID poolId, String itemId);

    <T> T recordEstimation(Supplier<T> estimation);
}
