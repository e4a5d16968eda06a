package uk.gegc.adaptivetest.features.session.domain.model;

import uk.gegc.adaptivetest.shared.exception.InvalidStateTransitionException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Snapshot of one examinee's adaptive test run.
 * <p>
 * Every transition returns a new snapshot; nothing here mutates. The administered items are
 * exactly the projection of {@link #responses()} in order, and never contain duplicates.
 * {@code pendingItemId} is the item issued to the examinee and not yet answered.
 * </p>
 */
public record AdaptiveSession(
        UUID id,
        UUID poolId,
        String examineeId,
        SessionConfig config,
        SessionStatus status,
        double theta,
        double standardError,
        List<ItemResponse> responses,
        String pendingItemId,
        StopReason stopReason,
        Instant startedAt,
        Instant endedAt,
        long version
) {

    public AdaptiveSession {
        responses = responses == null ? List.of() : List.copyOf(responses);
        Set<String> seen = new HashSet<>();
        for (ItemResponse response : responses) {
            if (!seen.add(response.itemId())) {
                throw new IllegalArgumentException("Item " + response.itemId() + " administered twice in session " + id);
            }
        }
    }

    public static AdaptiveSession create(UUID id, UUID poolId, String examineeId, SessionConfig config) {
        return new AdaptiveSession(id, poolId, examineeId, config, SessionStatus.CREATED,
                config.initialAbility(), Double.POSITIVE_INFINITY, List.of(), null, null, null, null, 0L);
    }

    public AdaptiveSession start(Instant now) {
        requireTransition(SessionStatus.IN_PROGRESS);
        return new AdaptiveSession(id, poolId, examineeId, config, SessionStatus.IN_PROGRESS,
                config.initialAbility(), Double.POSITIVE_INFINITY, List.of(), null, null, now, null, version);
    }

    public AdaptiveSession withPendingItem(String itemId) {
        return new AdaptiveSession(id, poolId, examineeId, config, status, theta, standardError,
                responses, itemId, stopReason, startedAt, endedAt, version);
    }

    public AdaptiveSession withResponse(ItemResponse response) {
        List<ItemResponse> appended = new ArrayList<>(responses);
        appended.add(response);
        return new AdaptiveSession(id, poolId, examineeId, config, status, response.thetaAfter(), response.seAfter(),
                appended, null, stopReason, startedAt, endedAt, version);
    }

    public AdaptiveSession complete(StopReason reason, Instant now) {
        requireTransition(SessionStatus.COMPLETED);
        return new AdaptiveSession(id, poolId, examineeId, config, SessionStatus.COMPLETED, theta, standardError,
                responses, null, reason, startedAt, now, version);
    }

    public AdaptiveSession abandon(Instant now) {
        requireTransition(SessionStatus.ABANDONED);
        return new AdaptiveSession(id, poolId, examineeId, config, SessionStatus.ABANDONED, theta, standardError,
                responses, null, null, startedAt, now, version);
    }

    public AdaptiveSession withVersion(long newVersion) {
        return new AdaptiveSession(id, poolId, examineeId, config, status, theta, standardError,
                responses, pendingItemId, stopReason, startedAt, endedAt, newVersion);
    }

    public List<String> administeredItemIds() {
        return responses.stream().map(ItemResponse::itemId).toList();
    }

    public boolean isAdministered(String itemId) {
        return responses.stream().anyMatch(r -> r.itemId().equals(itemId));
    }

    public int questionsAnswered() {
        return responses.size();
    }

    public long correctAnswers() {
        return responses.stream().filter(ItemResponse::correct).count();
    }

    /**
     * Initial ability followed by the estimate after each response.
     */
    public List<Double> abilityHistory() {
        List<Double> history = new ArrayList<>(responses.size() + 1);
        history.add(config.initialAbility());
        responses.forEach(r -> history.add(r.thetaAfter()));
        return history;
    }

    /**
     * Number of administered items per topic, in order of first appearance.
     */
    public Map<String, Long> topicCoverage() {
        Map<String, Long> coverage = new LinkedHashMap<>();
        responses.forEach(r -> coverage.merge(r.topic(), 1L, Long::sum));
        return coverage;
    }

    private void requireTransition(SessionStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(id, "Session " + id + " cannot move from " + status + " to " + target);
        }
    }
}
