package uk.gegc.adaptivetest.features.pool.infra.persistence;

import org.springframework.stereotype.Repository;
import uk.gegc.adaptivetest.features.pool.domain.model.QuestionPool;
import uk.gegc.adaptivetest.features.pool.domain.repository.QuestionPoolRepository;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps pools in memory. Pools are shared by reference so exposure counters stay live across sessions.
 */
@Repository
public class InMemoryQuestionPoolRepository implements QuestionPoolRepository {

    private final ConcurrentMap<UUID, QuestionPool> pools = new ConcurrentHashMap<>();

    @Override
    public Optional<QuestionPool> findById(UUID poolId) {
        return poolId == null ? Optional.empty() : Optional.ofNullable(pools.get(poolId));
    }

    @Override
    public QuestionPool save(QuestionPool pool) {
        pools.put(pool.getId(), pool);
        return pool;
    }
}
