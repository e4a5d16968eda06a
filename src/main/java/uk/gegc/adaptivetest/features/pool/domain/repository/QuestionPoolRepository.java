package uk.gegc.adaptivetest.features.pool.domain.repository;

import uk.gegc.adaptivetest.features.pool.domain.model.QuestionPool;

import java.util.Optional;
import java.util.UUID;

public interface QuestionPoolRepository {

    Optional<QuestionPool> findById(UUID poolId);

    QuestionPool save(QuestionPool pool);
}
