package uk.gegc.adaptivetest.features.session.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.springframework.context.ApplicationEventPublisher;
import uk.gegc.adaptivetest.BaseUnitTest;
import uk.gegc.adaptivetest.features.pool.domain.model.Item;
import uk.gegc.adaptivetest.features.pool.domain.model.QuestionPool;
import uk.gegc.adaptivetest.features.session.api.dto.SubmissionResult;
import uk.gegc.adaptivetest.features.session.domain.model.SessionConfig;
import uk.gegc.adaptivetest.features.session.domain.model.SessionStatus;
import uk.gegc.adaptivetest.testsupport.TestEngine;

import java.util.Random;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static uk.gegc.adaptivetest.testsupport.ItemFixtures.correctMcAnswer;
import static uk.gegc.adaptivetest.testsupport.ItemFixtures.mcItem;
import static uk.gegc.adaptivetest.testsupport.ItemFixtures.wrongMcAnswer;

/**
 * Simulated examinees answer according to the 3PL model at a known true ability; the adaptive
 * estimate should land close to it for most of them.
 */
@DisplayName("Ability convergence simulation")
class AbilityConvergenceTest extends BaseUnitTest {

    private static final int POOL_SIZE = 300;
    private static final int EXAMINEES = 40;
    private static final int TEST_LENGTH = 40;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Test
    @DisplayName("Estimated theta lies within 0.3 of the true ability for most examinees")
    void estimatesConverge() {
        TestEngine engine = new TestEngine();
        AdaptiveSessionServiceImpl service = engine.sessionService(eventPublisher);
        Random random = new Random(20250301L);

        QuestionPool pool = engine.getPoolService().createPool("tenant-sim", "Simulation", "math");
        for (int i = 0; i < POOL_SIZE; i++) {
            double a = 1.2 + random.nextDouble();
            double b = -3.0 + 6.0 * random.nextDouble();
            engine.getPoolService().addItem(pool.getId(), mcItem(String.format("sim-%03d", i), b, a, 0.0));
        }
        SessionConfig config = service.defaultConfig().toBuilder()
                .maxQuestions(TEST_LENGTH)
                .minQuestions(TEST_LENGTH)
                .seThreshold(0.01)
                .exposureControl(false)
                .topicBalancing(false)
                .build();

        int close = 0;
        double totalError = 0.0;
        for (int e = 0; e < EXAMINEES; e++) {
            double trueTheta = -2.0 + 4.0 * random.nextDouble();
            UUID sessionId = service.startSession(pool.getId(), "examinee-" + e, config);

            SubmissionResult result;
            do {
                Item item = service.nextItem(sessionId);
                boolean correct = random.nextDouble() < engine.getModel().probability(trueTheta, item);
                result = service.submitResponse(sessionId, item.id(), correct ? correctMcAnswer() : wrongMcAnswer(), null);
            } while (result.status() == SessionStatus.IN_PROGRESS);

            assertThat(result.questionsAnswered()).isEqualTo(TEST_LENGTH);
            double error = Math.abs(result.theta() - trueTheta);
            totalError += error;
            if (error <= 0.3) {
                close++;
            }
        }

        assertThat((double) close / EXAMINEES).isGreaterThanOrEqualTo(0.75);
        assertThat(totalError / EXAMINEES).isLessThan(0.25);
    }
}
