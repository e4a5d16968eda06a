package uk.gegc.adaptivetest.features.session.api.dto;

import uk.gegc.adaptivetest.features.session.domain.model.SessionStatus;
import uk.gegc.adaptivetest.features.session.domain.model.StopReason;

/**
 * Outcome of one submitted response. {@code stopReason} is set when the response ended the session.
 */
public record SubmissionResult(
        boolean correct,
        double theta,
        double standardError,
        SessionStatus status,
        StopReason stopReason,
        int questionsAnswered
) {
}
