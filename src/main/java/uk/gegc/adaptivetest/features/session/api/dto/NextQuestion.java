package uk.gegc.adaptivetest.features.session.api.dto;

import uk.gegc.adaptivetest.features.pool.domain.model.Item;
import uk.gegc.adaptivetest.features.session.domain.model.StopReason;

import java.util.UUID;

/**
 * Either the item to present next or a stop signal with the reason the session ended.
 *
 * @param questionNumber 1-based position of {@code item} in the session, or the number of answered items when stopped
 */
public record NextQuestion(
        UUID sessionId,
        Item item,
        boolean stop,
        StopReason stopReason,
        int questionNumber
) {

    public static NextQuestion question(UUID sessionId, Item item, int questionNumber) {
        return new NextQuestion(sessionId, item, false, null, questionNumber);
    }

    public static NextQuestion stopSignal(UUID sessionId, StopReason reason, int questionsAnswered) {
        return new NextQuestion(sessionId, null, true, reason, questionsAnswered);
    }
}
