package uk.gegc.adaptivetest.features.session.infra.persistence;

import org.springframework.stereotype.Repository;
import uk.gegc.adaptivetest.features.report.domain.model.AdaptiveTestReport;
import uk.gegc.adaptivetest.features.session.domain.model.AdaptiveSession;
import uk.gegc.adaptivetest.features.session.domain.model.ItemResponse;
import uk.gegc.adaptivetest.features.session.domain.model.SessionStatus;
import uk.gegc.adaptivetest.features.session.domain.repository.AdaptiveSessionRepository;
import uk.gegc.adaptivetest.shared.exception.SessionConcurrencyException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
public class InMemoryAdaptiveSessionRepository implements AdaptiveSessionRepository {

    private final ConcurrentMap<UUID, AdaptiveSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<UUID, List<ItemResponse>> responses = new ConcurrentHashMap<>();
    private final ConcurrentMap<UUID, AdaptiveTestReport> reports = new ConcurrentHashMap<>();

    @Override
    public Optional<AdaptiveSession> findById(UUID sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public Optional<AdaptiveSession> findInProgress(UUID poolId, String examineeId) {
        return sessions.values().stream()
                .filter(s -> s.status() == SessionStatus.IN_PROGRESS)
                .filter(s -> s.poolId().equals(poolId) && s.examineeId().equals(examineeId))
                .findFirst();
    }

    @Override
    public AdaptiveSession save(AdaptiveSession session) {
        return sessions.compute(session.id(), (id, stored) -> {
            long storedVersion = stored == null ? 0L : stored.version();
            if (storedVersion != session.version()) {
                throw new SessionConcurrencyException(id, session.version(), storedVersion);
            }
            return session.withVersion(storedVersion + 1);
        });
    }

    @Override
    public void appendResponse(UUID sessionId, ItemResponse response) {
        responses.computeIfAbsent(sessionId, id -> new CopyOnWriteArrayList<>()).add(response);
    }

    @Override
    public List<ItemResponse> findResponses(UUID sessionId) {
        return List.copyOf(responses.getOrDefault(sessionId, List.of()));
    }

    @Override
    public void saveReport(AdaptiveTestReport report) {
        reports.put(report.sessionId(), report);
    }

    @Override
    public Optional<AdaptiveTestReport> findReport(UUID sessionId) {
        return Optional.ofNullable(reports.get(sessionId));
    }
}
