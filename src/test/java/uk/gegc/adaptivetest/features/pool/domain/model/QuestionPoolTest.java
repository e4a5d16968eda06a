package uk.gegc.adaptivetest.features.pool.domain.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.adaptivetest.BaseUnitTest;
import uk.gegc.adaptivetest.shared.exception.InvalidItemParametersException;
import uk.gegc.adaptivetest.shared.exception.ResourceNotFoundException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.gegc.adaptivetest.testsupport.ItemFixtures.mcItem;

@DisplayName("QuestionPool Tests")
class QuestionPoolTest extends BaseUnitTest {

    private QuestionPool pool;

    @BeforeEach
    void setUp() {
        pool = new QuestionPool(UUID.randomUUID(), "tenant-1", "Algebra", "math", Instant.parse("2025-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("addItem: rejects non-positive discrimination")
    void rejectsNonPositiveDiscrimination() {
        assertThatThrownBy(() -> pool.addItem(mcItem("q1", 0.0, 0.0, 0.2)))
                .isInstanceOf(InvalidItemParametersException.class)
                .hasMessageContaining("discrimination");
        assertThatThrownBy(() -> pool.addItem(mcItem("q1", 0.0, -1.0, 0.2)))
                .isInstanceOf(InvalidItemParametersException.class);
        assertThat(pool.size()).isZero();
    }

    @Test
    @DisplayName("addItem: rejects guessing outside [0, 1)")
    void rejectsGuessingOutOfRange() {
        assertThatThrownBy(() -> pool.addItem(mcItem("q1", 0.0, 1.0, 1.0)))
                .isInstanceOf(InvalidItemParametersException.class)
                .hasMessageContaining("guessing");
        assertThatThrownBy(() -> pool.addItem(mcItem("q1", 0.0, 1.0, -0.01)))
                .isInstanceOf(InvalidItemParametersException.class);
        assertThatThrownBy(() -> pool.addItem(mcItem("q1", 0.0, 1.0, Double.NaN)))
                .isInstanceOf(InvalidItemParametersException.class);
    }

    @Test
    @DisplayName("addItem: rejects missing required fields and non-finite difficulty")
    void rejectsMissingFields() {
        assertThatThrownBy(() -> pool.addItem(mcItem("q1", 0.0, 1.0, 0.2).toBuilder().text(" ").build()))
                .isInstanceOf(InvalidItemParametersException.class)
                .hasMessageContaining("text");
        assertThatThrownBy(() -> pool.addItem(mcItem("q1", 0.0, 1.0, 0.2).toBuilder().type(null).build()))
                .isInstanceOf(InvalidItemParametersException.class);
        assertThatThrownBy(() -> pool.addItem(mcItem("q1", 0.0, 1.0, 0.2).toBuilder().correctAnswer(null).build()))
                .isInstanceOf(InvalidItemParametersException.class);
        assertThatThrownBy(() -> pool.addItem(mcItem(null, 0.0, 1.0, 0.2)))
                .isInstanceOf(InvalidItemParametersException.class);
        assertThatThrownBy(() -> pool.addItem(mcItem("q1", Double.POSITIVE_INFINITY, 1.0, 0.2)))
                .isInstanceOf(InvalidItemParametersException.class);
    }

    @Test
    @DisplayName("addItem: rejects a duplicate id and keeps the original item")
    void rejectsDuplicateId() {
        pool.addItem(mcItem("q1", 0.0, 1.0, 0.2));

        assertThatThrownBy(() -> pool.addItem(mcItem("q1", 1.0, 2.0, 0.2)))
                .isInstanceOf(InvalidItemParametersException.class)
                .satisfies(e -> assertThat(((InvalidItemParametersException) e).getItemId()).isEqualTo("q1"));
        assertThat(pool.getItem("q1").difficulty()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("unadministeredItems: set difference ordered by id")
    void unadministeredItems() {
        pool.addItem(mcItem("q3", 0.0, 1.0, 0.2));
        pool.addItem(mcItem("q1", 0.0, 1.0, 0.2));
        pool.addItem(mcItem("q2", 0.0, 1.0, 0.2));

        assertThat(pool.unadministeredItems(List.of("q2")))
                .extracting(Item::id)
                .containsExactly("q1", "q3");
        assertThat(pool.unadministeredItems(List.of("q1", "q2", "q3"))).isEmpty();
    }

    @Test
    @DisplayName("getItem: unknown id throws ResourceNotFoundException")
    void getUnknownItem() {
        assertThatThrownBy(() -> pool.getItem("missing"))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThat(pool.findItem("missing")).isEmpty();
    }

    @Test
    @DisplayName("exposureRate: exposures divided by sessions started")
    void exposureRate() {
        pool.addItem(mcItem("q1", 0.0, 1.0, 0.2));
        assertThat(pool.exposureRate("q1")).isZero();

        for (int i = 0; i < 4; i++) {
            pool.registerSession();
        }
        pool.recordExposure("q1");

        assertThat(pool.exposureCount("q1")).isEqualTo(1);
        assertThat(pool.exposureRate("q1")).isEqualTo(0.25);
    }

    @Test
    @DisplayName("recordExposure: concurrent increments are not lost")
    void concurrentExposureIsAtomic() throws Exception {
        pool.addItem(mcItem("q1", 0.0, 1.0, 0.2));
        pool.addItem(mcItem("q2", 0.0, 1.0, 0.2));
        int threads = 8;
        int perThread = 1_000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        pool.recordExposure("q1");
                        pool.recordExposure("q2");
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(pool.exposureCount("q1")).isEqualTo((long) threads * perThread);
        assertThat(pool.exposureCount("q2")).isEqualTo((long) threads * perThread);
        assertThat(pool.totalExposures()).isEqualTo(2L * threads * perThread);
    }

    @Test
    @DisplayName("recordUsage: tracks correct answers and average response time")
    void recordUsage() {
        pool.addItem(mcItem("q1", 0.0, 1.0, 0.2));

        pool.recordUsage("q1", true, 10.0);
        pool.recordUsage("q1", false, 20.0);
        pool.recordUsage("q1", true, null);

        QuestionPool.ItemUsage usage = pool.usage("q1");
        assertThat(usage.usageCount()).isEqualTo(3);
        assertThat(usage.correctCount()).isEqualTo(2);
        assertThat(usage.averageResponseTimeSeconds()).isEqualTo(15.0);
    }
}
