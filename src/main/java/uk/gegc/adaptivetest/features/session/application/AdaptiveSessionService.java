package uk.gegc.adaptivetest.features.session.application;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.adaptivetest.features.pool.domain.model.Item;
import uk.gegc.adaptivetest.features.report.domain.model.AdaptiveTestReport;
import uk.gegc.adaptivetest.features.session.api.dto.NextQuestion;
import uk.gegc.adaptivetest.features.session.api.dto.SubmissionResult;
import uk.gegc.adaptivetest.features.session.domain.model.AdaptiveSession;
import uk.gegc.adaptivetest.features.session.domain.model.SessionConfig;
import uk.gegc.adaptivetest.shared.exception.InvalidStateTransitionException;
import uk.gegc.adaptivetest.shared.exception.NoEligibleItemsException;
import uk.gegc.adaptivetest.shared.exception.ResourceNotFoundException;

import java.util.UUID;

public interface AdaptiveSessionService {

    /**
     * Starts a session, or returns the id of the examinee's session already in progress on the pool.
     *
     * @param config {@code null} to use the configured defaults
     * @throws ResourceNotFoundException if the pool does not exist
     * @throws uk.gegc.adaptivetest.shared.exception.InvalidSessionConfigException if the config is out of range
     */
    UUID startSession(UUID poolId, String examineeId, SessionConfig config);

    /**
     * Issues the next item. Calling again before answering returns the same item.
     *
     * @throws NoEligibleItemsException if no item can be selected; complete the session in response
     * @throws InvalidStateTransitionException if the session is not in progress
     */
    Item nextItem(UUID sessionId);

    /**
     * Like {@link #nextItem(UUID)} but checks the stopping rules first, completing the session
     * and returning a stop signal when one fires. A completed session yields its recorded stop reason.
     */
    NextQuestion getNextQuestion(UUID sessionId);

    /**
     * Scores the answer to the issued item, re-estimates ability and applies the stopping rules.
     * Either every effect of the call is stored or none is.
     *
     * @param responseTimeSeconds may be {@code null}
     */
    SubmissionResult submitResponse(UUID sessionId, String itemId, JsonNode answer, Double responseTimeSeconds);

    /**
     * Completes the session and returns its report. Returns the stored report if already completed.
     */
    AdaptiveTestReport completeSession(UUID sessionId);

    AdaptiveSession abandonSession(UUID sessionId);

    AdaptiveSession getSession(UUID sessionId);

    /**
     * @throws uk.gegc.adaptivetest.shared.exception.SessionNotCompletedException if the session is not completed
     */
    AdaptiveTestReport getReport(UUID sessionId);

    SessionConfig defaultConfig();
}
