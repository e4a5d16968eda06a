package uk.gegc.adaptivetest.features.session.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.adaptivetest.features.session.domain.model.StopReason;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once when a session reaches COMPLETED, after its report has been stored.
 */
public class AdaptiveSessionCompletedEvent extends ApplicationEvent {

    private final UUID sessionId;
    private final UUID poolId;
    private final String examineeId;
    private final double finalTheta;
    private final double finalStandardError;
    private final StopReason stopReason;
    private final Instant completedAt;

    public AdaptiveSessionCompletedEvent(Object source, UUID sessionId, UUID poolId, String examineeId,
                                         double finalTheta, double finalStandardError,
                                         StopReason stopReason, Instant completedAt) {
        super(source);
        this.sessionId = sessionId;
        this.poolId = poolId;
        this.examineeId = examineeId;
        this.finalTheta = finalTheta;
        this.finalStandardError = finalStandardError;
        this.stopReason = stopReason;
        this.completedAt = completedAt;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public UUID getPoolId() {
        return poolId;
    }

    public String getExamineeId() {
        return examineeId;
    }

    public double getFinalTheta() {
        return finalTheta;
    }

    public double getFinalStandardError() {
        return finalStandardError;
    }

    public StopReason getStopReason() {
        return stopReason;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
