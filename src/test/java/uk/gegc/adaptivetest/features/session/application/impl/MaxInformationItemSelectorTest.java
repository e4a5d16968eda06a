package uk.gegc.adaptivetest.features.session.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.adaptivetest.BaseUnitTest;
import uk.gegc.adaptivetest.features.pool.application.impl.ThreeParameterLogisticModel;
import uk.gegc.adaptivetest.features.pool.domain.model.Item;
import uk.gegc.adaptivetest.features.pool.domain.model.QuestionPool;
import uk.gegc.adaptivetest.features.session.application.ItemSelector.RankedItem;
import uk.gegc.adaptivetest.features.session.domain.model.AdaptiveSession;
import uk.gegc.adaptivetest.features.session.domain.model.ItemResponse;
import uk.gegc.adaptivetest.features.session.domain.model.SelectionMethod;
import uk.gegc.adaptivetest.features.session.domain.model.SessionConfig;
import uk.gegc.adaptivetest.shared.config.AdaptiveTestingProperties;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static uk.gegc.adaptivetest.testsupport.ItemFixtures.mcItem;

@DisplayName("MaxInformationItemSelector Tests")
class MaxInformationItemSelectorTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2025-02-01T12:00:00Z");

    private AdaptiveTestingProperties properties;
    private MaxInformationItemSelector selector;
    private QuestionPool pool;
    private SessionConfig config;

    @BeforeEach
    void setUp() {
        properties = new AdaptiveTestingProperties();
        selector = new MaxInformationItemSelector(new ThreeParameterLogisticModel(), properties);
        pool = new QuestionPool(UUID.randomUUID(), "tenant-1", "Pool", "math", NOW);
        config = SessionConfig.builder()
                .maxQuestions(3)
                .minQuestions(1)
                .seThreshold(0.01)
                .initialAbility(0.0)
                .topicBalancing(true)
                .exposureControl(true)
                .build();
    }

    @Test
    @DisplayName("selectNext: picks the item with peak information at theta 0 without recording exposure")
    void picksMiddleItemFirst() {
        addReferenceItems();
        AdaptiveSession session = session(config);

        Optional<Item> selected = selector.selectNext(session, pool);

        assertThat(selected).map(Item::id).contains("B");
        assertThat(pool.totalExposures()).isZero();

        selector.recordExposure(session, pool, selected.orElseThrow());
        assertThat(pool.exposureCount("B")).isEqualTo(1);
        assertThat(pool.exposureCount("A")).isZero();
    }

    @Test
    @DisplayName("selectNext: after theta rises above 0 the hard item is preferred")
    void favoursHardItemAfterRise() {
        addReferenceItems();
        AdaptiveSession session = session(config).withResponse(response("B", null, 0.0, 0.0, true, 1.0));

        assertThat(selector.selectNext(session, pool)).map(Item::id).contains("C");
    }

    @Test
    @DisplayName("rankCandidates: excludes administered items and has no side effects")
    void excludesAdministered() {
        addReferenceItems();
        AdaptiveSession session = session(config).withResponse(response("B", null, 0.0, 0.0, true, 1.0));

        assertThat(selector.rankCandidates(session, pool))
                .extracting(r -> r.item().id())
                .containsExactly("C", "A");
        assertThat(pool.totalExposures()).isZero();
    }

    @Test
    @DisplayName("selectNext: empty candidate set returns empty and records nothing")
    void emptyPool() {
        pool.addItem(mcItem("only", 0.0, 1.0, 0.2));
        AdaptiveSession session = session(config).withResponse(response("only", null, 0.0, 0.0, true, 1.0));

        assertThat(selector.selectNext(session, pool)).isEmpty();
        assertThat(selector.hasCandidates(session, pool)).isFalse();
        assertThat(pool.totalExposures()).isZero();
    }

    @Test
    @DisplayName("rankCandidates: ties are broken by lowest item id")
    void tieBreakById() {
        pool.addItem(mcItem("x2", 0.0, 1.4, 0.2));
        pool.addItem(mcItem("x3", 0.0, 1.4, 0.2));
        pool.addItem(mcItem("x1", 0.0, 1.4, 0.2));

        assertThat(selector.rankCandidates(session(config), pool))
                .extracting(r -> r.item().id())
                .containsExactly("x1", "x2", "x3");
    }

    @Test
    @DisplayName("Exposure control: over-exposed items are skipped after warm-up")
    void exposureControlSkipsOverExposed() {
        pool.addItem(mcItem("best", 0.0, 2.0, 0.0));
        pool.addItem(mcItem("second", 0.5, 1.5, 0.0));
        for (int i = 0; i < 20; i++) {
            pool.registerSession();
        }
        for (int i = 0; i < 10; i++) {
            pool.recordExposure("best");
        }

        assertThat(selector.selectNext(session(config), pool)).map(Item::id).contains("second");

        SessionConfig uncontrolled = config.toBuilder().exposureControl(false).build();
        assertThat(selector.rankCandidates(session(uncontrolled), pool).get(0).item().id()).isEqualTo("best");
    }

    @Test
    @DisplayName("Exposure control: not applied during warm-up")
    void exposureControlWarmUp() {
        pool.addItem(mcItem("best", 0.0, 2.0, 0.0));
        pool.addItem(mcItem("second", 0.5, 1.5, 0.0));
        for (int i = 0; i < 5; i++) {
            pool.registerSession();
            pool.recordExposure("best");
        }

        assertThat(selector.rankCandidates(session(config), pool).get(0).item().id()).isEqualTo("best");
    }

    @Test
    @DisplayName("Exposure control: falls back to all candidates when every one is over-exposed")
    void exposureControlFallback() {
        pool.addItem(mcItem("best", 0.0, 2.0, 0.0));
        pool.addItem(mcItem("second", 0.5, 1.5, 0.0));
        for (int i = 0; i < 20; i++) {
            pool.registerSession();
            pool.recordExposure("best");
            pool.recordExposure("second");
        }

        assertThat(selector.selectNext(session(config), pool)).map(Item::id).contains("best");
    }

    @Test
    @DisplayName("Topic balancing: under-represented topic wins over slightly more informative item")
    void topicBalancingReRanks() {
        pool.addItem(mcItem("alg1", 0.0, 1.5, 0.0, "algebra"));
        pool.addItem(mcItem("alg2", 0.0, 1.5, 0.0, "algebra"));
        pool.addItem(mcItem("alg3", 0.0, 1.5, 0.0, "algebra"));
        pool.addItem(mcItem("geo1", 0.3, 1.5, 0.0, "geometry"));
        AdaptiveSession session = session(config)
                .withResponse(response("alg1", "algebra", 0.0, 0.0, true, 0.0))
                .withResponse(response("alg2", "algebra", 0.0, 0.0, false, 0.0));

        RankedItem best = selector.rankCandidates(session, pool).get(0);
        assertThat(best.item().id()).isEqualTo("geo1");
        assertThat(best.score()).isGreaterThan(best.criterion());

        SessionConfig unbalanced = config.toBuilder().topicBalancing(false).build();
        assertThat(selector.rankCandidates(session(unbalanced)
                        .withResponse(response("alg1", "algebra", 0.0, 0.0, true, 0.0))
                        .withResponse(response("alg2", "algebra", 0.0, 0.0, false, 0.0)), pool)
                .get(0).item().id()).isEqualTo("alg3");
    }

    @Test
    @DisplayName("Topic balancing: explicit targets steer selection and never empty the candidate set")
    void topicTargets() {
        pool.addItem(mcItem("alg1", 0.0, 1.5, 0.0, "algebra"));
        pool.addItem(mcItem("geo1", 0.2, 1.5, 0.0, "geometry"));
        SessionConfig targeted = config.toBuilder().topicTargets(Map.of("geometry", 3.0, "algebra", 1.0)).build();

        assertThat(selector.rankCandidates(session(targeted), pool).get(0).item().id()).isEqualTo("geo1");

        SessionConfig onlyHistory = config.toBuilder().topicTargets(Map.of("history", 1.0)).build();
        assertThat(selector.rankCandidates(session(onlyHistory), pool)).hasSize(2);
    }

    @Test
    @DisplayName("Topic balancing: topics outside explicit targets rank below targeted ones and fall as they are used")
    void untargetedTopicsAreWantedAtZeroShare() {
        pool.addItem(mcItem("alg1", 0.0, 1.5, 0.0, "algebra"));
        pool.addItem(mcItem("geo1", 0.0, 1.5, 0.0, "geometry"));
        pool.addItem(mcItem("his1", 0.0, 1.5, 0.0, "history"));
        pool.addItem(mcItem("his2", 0.0, 1.5, 0.0, "history"));
        SessionConfig targeted = config.toBuilder().topicTargets(Map.of("algebra", 1.0, "geometry", 1.0)).build();

        List<RankedItem> fresh = selector.rankCandidates(session(targeted), pool);
        assertThat(fresh).extracting(r -> r.item().id()).containsExactly("alg1", "geo1", "his1", "his2");
        assertThat(fresh.get(0).score()).isCloseTo(1.25 * fresh.get(0).criterion(), within(1e-12));
        assertThat(fresh.get(2).score()).isCloseTo(fresh.get(2).criterion(), within(1e-12));

        AdaptiveSession afterHistory = session(targeted)
                .withResponse(response("his1", "history", 0.0, 0.0, true, 0.0));
        RankedItem last = selector.rankCandidates(afterHistory, pool).get(2);
        assertThat(last.item().id()).isEqualTo("his2");
        assertThat(last.score()).isCloseTo(0.5 * last.criterion(), within(1e-12));
    }

    @Test
    @DisplayName("CLOSEST_DIFFICULTY ranks by |b - theta|")
    void closestDifficulty() {
        pool.addItem(mcItem("steep", 1.0, 3.0, 0.0));
        pool.addItem(mcItem("near", 0.1, 0.3, 0.0));
        SessionConfig closest = config.toBuilder().selectionMethod(SelectionMethod.CLOSEST_DIFFICULTY).build();

        assertThat(selector.rankCandidates(session(closest), pool).get(0).item().id()).isEqualTo("near");
        assertThat(selector.rankCandidates(session(config), pool).get(0).item().id()).isEqualTo("steep");
    }

    private void addReferenceItems() {
        pool.addItem(mcItem("A", -2.0, 1.2, 0.25));
        pool.addItem(mcItem("B", 0.0, 1.5, 0.25));
        pool.addItem(mcItem("C", 2.0, 1.8, 0.25));
    }

    private AdaptiveSession session(SessionConfig sessionConfig) {
        return AdaptiveSession.create(UUID.randomUUID(), pool.getId(), "examinee-1", sessionConfig).start(NOW);
    }

    private ItemResponse response(String itemId, String topic, double difficulty, double thetaBefore,
                                  boolean correct, double thetaAfter) {
        return new ItemResponse(itemId, 1, topic == null ? Item.UNASSIGNED_TOPIC : topic, difficulty, null, correct,
                null, thetaBefore, thetaAfter, 1.0, NOW);
    }
}
