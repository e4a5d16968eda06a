package uk.gegc.adaptivetest.features.session.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.adaptivetest.features.session.application.AdaptiveTestMetricsService;
import uk.gegc.adaptivetest.features.session.domain.model.StopReason;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Micrometer-backed metrics for sessions, responses and item exposure.
 */
@Slf4j
@Service
public class AdaptiveTestMetricsServiceImpl implements AdaptiveTestMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter sessionStartedCounter;
    private final Counter sessionAbandonedCounter;
    private final Counter responseCorrectCounter;
    private final Counter responseIncorrectCounter;
    private final Counter itemExposedCounter;

    private final Timer estimationTimer;

    public AdaptiveTestMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.sessionStartedCounter = Counter.builder("cat.sessions.started")
                .description("Number of adaptive sessions started")
                .register(meterRegistry);
        this.sessionAbandonedCounter = Counter.builder("cat.sessions.abandoned")
                .description("Number of adaptive sessions abandoned")
                .register(meterRegistry);
        this.responseCorrectCounter = Counter.builder("cat.responses.recorded")
                .description("Number of scored responses")
                .tag("correct", "true")
                .register(meterRegistry);
        this.responseIncorrectCounter = Counter.builder("cat.responses.recorded")
                .description("Number of scored responses")
                .tag("correct", "false")
                .register(meterRegistry);
        this.itemExposedCounter = Counter.builder("cat.items.exposed")
                .description("Number of items issued to examinees")
                .register(meterRegistry);

        this.estimationTimer = Timer.builder("cat.estimation.latency")
                .description("Ability estimation latency")
                .register(meterRegistry);
    }

    @Override
    public void incrementSessionStarted(UUID sessionId, UUID poolId) {
        log.info("METRIC: cat.sessions.started sessionId={} poolId={}", sessionId, poolId);
        sessionStartedCounter.increment();
    }

    @Override
    public void incrementSessionCompleted(UUID sessionId, StopReason reason, int questionsAnswered) {
        log.info("METRIC: cat.sessions.completed sessionId={} reason={} questions={}",
                sessionId, reason.getCode(), questionsAnswered);
        Counter.builder("cat.sessions.completed")
                .description("Number of adaptive sessions completed")
                .tag("reason", reason.getCode())
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementSessionAbandoned(UUID sessionId, int questionsAnswered) {
        log.info("METRIC: cat.sessions.abandoned sessionId={} questions={}", sessionId, questionsAnswered);
        sessionAbandonedCounter.increment();
    }

    @Override
    public void incrementResponseRecorded(UUID sessionId, boolean correct) {
        if (correct) {
            responseCorrectCounter.increment();
        } else {
            responseIncorrectCounter.increment();
        }
    }

    @Override
    public void incrementItemExposed(UUID poolId, String itemId) {
        itemExposedCounter.increment();
    }

    @Override
    public <T> T recordEstimation(Supplier<T> estimation) {
        return estimationTimer.record(estimation);
    }
}
