package uk.gegc.adaptivetest.features.session.application;

import uk.gegc.adaptivetest.features.session.domain.model.StopReason;

public record StopDecision(boolean stop, StopReason reason) {

    private static final StopDecision CONTINUE = new StopDecision(false, null);

    public static StopDecision continueSession() {
        return CONTINUE;
    }

    public static StopDecision stopWith(StopReason reason) {
        return new StopDecision(true, reason);
    }
}
