package uk.gegc.adaptivetest.features.session.domain.repository;

import uk.gegc.adaptivetest.features.report.domain.model.AdaptiveTestReport;
import uk.gegc.adaptivetest.features.session.domain.model.AdaptiveSession;
import uk.gegc.adaptivetest.features.session.domain.model.ItemResponse;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence boundary for sessions, their response log and their reports.
 */
public interface AdaptiveSessionRepository {

    Optional<AdaptiveSession> findById(UUID sessionId);

    Optional<AdaptiveSession> findInProgress(UUID poolId, String examineeId);

    /**
     * Stores the session if its version matches the stored one and returns it with the next version.
     *
     * @throws uk.gegc.adaptivetest.shared.exception.SessionConcurrencyException on a version mismatch
     */
    AdaptiveSession save(AdaptiveSession session);

    void appendResponse(UUID sessionId, ItemResponse response);

    List<ItemResponse> findResponses(UUID sessionId);

    void saveReport(AdaptiveTestReport report);

    Optional<AdaptiveTestReport> findReport(UUID sessionId);
}
