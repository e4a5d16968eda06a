package uk.gegc.adaptivetest.features.session.domain.model;

/**
 * Lifecycle of an adaptive session: CREATED, then IN_PROGRESS, then one of the terminal states.
 */
public enum SessionStatus {

    CREATED,

    IN_PROGRESS,

    COMPLETED,

    /**
     * Examinee left without finishing; no report is produced.
     */
    ABANDONED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABANDONED;
    }

    public boolean canTransitionTo(SessionStatus target) {
        return switch (this) {
            case CREATED -> target == IN_PROGRESS;
            case IN_PROGRESS -> target == COMPLETED || target == ABANDONED;
            case COMPLETED, ABANDONED -> false;
        };
    }
}
