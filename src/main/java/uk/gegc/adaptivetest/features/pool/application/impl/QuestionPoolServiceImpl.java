package uk.gegc.adaptivetest.features.pool.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.adaptivetest.features.pool.application.ItemResponseModel;
import uk.gegc.adaptivetest.features.pool.application.QuestionPoolService;
import uk.gegc.adaptivetest.features.pool.domain.model.Item;
import uk.gegc.adaptivetest.features.pool.domain.model.ItemStatistics;
import uk.gegc.adaptivetest.features.pool.domain.model.QuestionPool;
import uk.gegc.adaptivetest.features.pool.domain.repository.QuestionPoolRepository;
import uk.gegc.adaptivetest.features.pool.infra.factory.ItemHandlerFactory;
import uk.gegc.adaptivetest.shared.exception.InvalidItemParametersException;
import uk.gegc.adaptivetest.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class QuestionPoolServiceImpl implements QuestionPoolService {

    private static final int CURVE_MIN_THETA = -3;
    private static final int CURVE_MAX_THETA = 3;

    private final QuestionPoolRepository poolRepository;
    private final ItemHandlerFactory handlerFactory;
    private final ItemResponseModel responseModel;
    private final Clock clock;

    @Override
    public QuestionPool createPool(String tenantId, String name, String subject) {
        QuestionPool pool = new QuestionPool(UUID.randomUUID(), tenantId, name, subject, Instant.now(clock));
        poolRepository.save(pool);
        log.info("Created question pool {} ({}) for tenant {}", pool.getId(), name, tenantId);
        return pool;
    }

    @Override
    public Item addItem(UUID poolId, Item item) {
        QuestionPool pool = getPool(poolId);
        if (item == null) {
            throw new InvalidItemParametersException(null, "Item is required");
        }
        if (item.type() == null) {
            throw new InvalidItemParametersException(item.id(), "type is required");
        }
        handlerFactory.getHandler(item.type()).validate(item);
        pool.addItem(item);
        log.debug("Added item {} (a={}, b={}, c={}) to pool {}",
                item.id(), item.discrimination(), item.difficulty(), item.guessing(), poolId);
        return item;
    }

    @Override
    public QuestionPool getPool(UUID poolId) {
        return poolRepository.findById(poolId)
                .orElseThrow(() -> new ResourceNotFoundException("Question pool " + poolId + " not found"));
    }

    @Override
    public Item getItem(UUID poolId, String itemId) {
        return getPool(poolId).getItem(itemId);
    }

    @Override
    public ItemStatistics getItemStatistics(UUID poolId, String itemId) {
        QuestionPool pool = getPool(poolId);
        Item item = pool.getItem(itemId);
        QuestionPool.ItemUsage usage = pool.usage(itemId);

        SortedMap<Double, Double> curve = new TreeMap<>();
        for (int theta = CURVE_MIN_THETA; theta <= CURVE_MAX_THETA; theta++) {
            curve.put((double) theta, responseModel.information(theta, item));
        }

        double correctRate = usage.usageCount() == 0 ? 0.0 : (double) usage.correctCount() / usage.usageCount();
        return new ItemStatistics(
                itemId,
                usage.usageCount(),
                usage.correctCount(),
                correctRate,
                usage.averageResponseTimeSeconds(),
                pool.exposureCount(itemId),
                pool.exposureRate(itemId),
                curve
        );
    }
}
