package uk.gegc.adaptivetest.features.session.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.adaptivetest.features.pool.application.ItemResponseModel;
import uk.gegc.adaptivetest.features.pool.domain.model.Item;
import uk.gegc.adaptivetest.features.pool.domain.model.QuestionPool;
import uk.gegc.adaptivetest.features.session.application.ItemSelector;
import uk.gegc.adaptivetest.features.session.domain.model.AdaptiveSession;
import uk.gegc.adaptivetest.features.session.domain.model.SessionConfig;
import uk.gegc.adaptivetest.shared.config.AdaptiveTestingProperties;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ranks unadministered items by information (or difficulty closeness) at the session's theta.
 * <p>
 * Exposure control drops over-exposed items once the pool is past its warm-up, falling back to
 * the full candidate set if nothing would remain. Topic balancing only re-weights scores, so it
 * never empties the candidate set. Ties go to the lowest item id.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MaxInformationItemSelector implements ItemSelector {

    private static final Comparator<RankedItem> RANKING = Comparator
            .comparingDouble(RankedItem::score).reversed()
            .thenComparing(r -> r.item().id());

    private final ItemResponseModel responseModel;
    private final AdaptiveTestingProperties properties;

    @Override
    public Optional<Item> selectNext(AdaptiveSession session, QuestionPool pool) {
        List<RankedItem> ranked = rankCandidates(session, pool);
        if (ranked.isEmpty()) {
            return Optional.empty();
        }
        RankedItem best = ranked.get(0);
        log.debug("Session {} selected item {} (criterion={}, score={}) at theta={}",
                session.id(), best.item().id(), best.criterion(), best.score(), session.theta());
        return Optional.of(best.item());
    }

    @Override
    public void recordExposure(AdaptiveSession session, QuestionPool pool, Item item) {
        long exposures = pool.recordExposure(item.id());
        log.debug("Session {} issued item {} (exposures={})", session.id(), item.id(), exposures);
    }

    @Override
    public List<RankedItem> rankCandidates(AdaptiveSession session, QuestionPool pool) {
        List<Item> candidates = pool.unadministeredItems(session.administeredItemIds());
        if (candidates.isEmpty()) {
            return List.of();
        }
        SessionConfig config = session.config();
        if (config.exposureControl()) {
            candidates = applyExposureControl(session, pool, candidates);
        }

        Map<String, Double> multipliers = config.topicBalancing()
                ? topicMultipliers(session, pool)
                : Map.of();

        return candidates.stream()
                .map(item -> {
                    double criterion = criterion(session, item);
                    double multiplier = multipliers.getOrDefault(item.topicKey(), 1.0);
                    return new RankedItem(item, criterion, criterion * multiplier);
                })
                .sorted(RANKING)
                .toList();
    }

    private double criterion(AdaptiveSession session, Item item) {
        return switch (session.config().selectionMethod()) {
            case MAXIMUM_INFORMATION -> responseModel.information(session.theta(), item);
            case CLOSEST_DIFFICULTY -> 1.0 / (1.0 + Math.abs(item.difficulty() - session.theta()));
        };
    }

    private List<Item> applyExposureControl(AdaptiveSession session, QuestionPool pool, List<Item> candidates) {
        AdaptiveTestingProperties.Selection selection = properties.getSelection();
        if (pool.sessionsStarted() < selection.getExposureWarmupSessions()) {
            return candidates;
        }
        List<Item> allowed = candidates.stream()
                .filter(item -> pool.exposureRate(item.id()) <= selection.getMaxExposureRate())
                .toList();
        if (allowed.isEmpty()) {
            log.warn("Exposure control would exclude all {} candidates for session {}; using unfiltered candidates",
                    candidates.size(), session.id());
            return candidates;
        }
        return allowed;
    }

    /**
     * Score multiplier per topic: 1 + weight * (desired share - actual share).
     */
    private Map<String, Double> topicMultipliers(AdaptiveSession session, QuestionPool pool) {
        double weight = properties.getSelection().getTopicBalanceWeight();
        Map<String, Double> desired = desiredShares(session.config(), pool);
        Map<String, Long> administered = session.topicCoverage();
        int answered = session.questionsAnswered();

        Map<String, Double> multipliers = new HashMap<>();
        desired.forEach((topic, share) -> {
            double actual = answered == 0 ? 0.0 : (double) administered.getOrDefault(topic, 0L) / answered;
            multipliers.put(topic, 1.0 + weight * (share - actual));
        });
        return multipliers;
    }

    /**
     * Normalized topic targets when given, with every other pool topic at 0; otherwise an even spread over the pool's topics.
     */
    private Map<String, Double> desiredShares(SessionConfig config, QuestionPool pool) {
        Map<String, Double> shares = new HashMap<>();
        Map<String, Double> targets = config.topicTargets();
        double targetTotal = targets.values().stream()
                .filter(v -> v != null && v > 0)
                .mapToDouble(Double::doubleValue)
                .sum();
        if (targetTotal > 0) {
            targets.forEach((topic, value) -> shares.put(topic, value != null && value > 0 ? value / targetTotal : 0.0));
            // untargeted topics are wanted at share 0, so their weight only falls as they are administered
            pool.items().forEach(item -> shares.putIfAbsent(item.topicKey(), 0.0));
            return shares;
        }
        Set<String> topics = new TreeSet<>();
        pool.items().forEach(item -> topics.add(item.topicKey()));
        topics.forEach(topic -> shares.put(topic, 1.0 / topics.size()));
        return shares;
    }
}
