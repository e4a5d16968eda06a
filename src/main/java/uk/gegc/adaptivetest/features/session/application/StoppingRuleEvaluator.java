package uk.gegc.adaptivetest.features.session.application;

import org.springframework.stereotype.Component;
import uk.gegc.adaptivetest.features.session.domain.model.AdaptiveSession;
import uk.gegc.adaptivetest.features.session.domain.model.SessionConfig;
import uk.gegc.adaptivetest.features.session.domain.model.StopReason;

import java.time.Duration;
import java.time.Instant;
import java.util.function.BooleanSupplier;

/**
 * Decides whether a session should end. Rules are checked in priority order:
 * question limit, time limit, precision, then pool exhaustion.
 */
@Component
public class StoppingRuleEvaluator {

    /**
     * @param candidatesAvailable asked only when no earlier rule fires
     */
    public StopDecision evaluate(AdaptiveSession session, Instant now, BooleanSupplier candidatesAvailable) {
        SessionConfig config = session.config();
        int answered = session.questionsAnswered();

        if (answered >= config.maxQuestions()) {
            return StopDecision.stopWith(StopReason.MAX_QUESTIONS_REACHED);
        }
        if (timeLimitReached(session, now)) {
            return StopDecision.stopWith(StopReason.TIME_LIMIT_REACHED);
        }
        if (answered >= config.minQuestions() && session.standardError() <= config.seThreshold()) {
            return StopDecision.stopWith(StopReason.PRECISION_REACHED);
        }
        if (!candidatesAvailable.getAsBoolean()) {
            return StopDecision.stopWith(StopReason.POOL_EXHAUSTED);
        }
        return StopDecision.continueSession();
    }

    private boolean timeLimitReached(AdaptiveSession session, Instant now) {
        Duration maxTime = session.config().maxTime();
        if (maxTime == null || session.startedAt() == null) {
            return false;
        }
        return Duration.between(session.startedAt(), now).compareTo(maxTime) >= 0;
    }
}
