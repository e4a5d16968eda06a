package uk.gegc.adaptivetest.features.pool.domain.model;

import lombok.AccessLevel;
import lombok.Getter;
import uk.gegc.adaptivetest.shared.exception.InvalidItemParametersException;
import uk.gegc.adaptivetest.shared.exception.ResourceNotFoundException;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Append-only collection of calibrated items shared by every session on the pool.
 * <p>
 * Each item lives in its own entry carrying atomic counters, so concurrent sessions
 * can record exposure and usage without a pool-wide lock. Reads of those counters are
 * point-in-time snapshots.
 * </p>
 */
@Getter
public class QuestionPool {

    private final UUID id;
    private final String tenantId;
    private final String name;
    private final String subject;
    private final Instant createdAt;

    @Getter(AccessLevel.NONE)
    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();

    @Getter(AccessLevel.NONE)
    private final AtomicLong sessionsStarted = new AtomicLong();

    public QuestionPool(UUID id, String tenantId, String name, String subject, Instant createdAt) {
        this.id = id;
        this.tenantId = tenantId;
        this.name = name;
        this.subject = subject;
        this.createdAt = createdAt;
    }

    public void addItem(Item item) {
        if (item == null) {
            throw new InvalidItemParametersException(null, "Item is required");
        }
        checkParameters(item);
        if (entries.putIfAbsent(item.id(), new Entry(item)) != null) {
            throw new InvalidItemParametersException(item.id(), "an item with this id already exists in pool " + id);
        }
    }

    public Optional<Item> findItem(String itemId) {
        Entry entry = itemId == null ? null : entries.get(itemId);
        return entry == null ? Optional.empty() : Optional.of(entry.item);
    }

    public Item getItem(String itemId) {
        return findItem(itemId)
                .orElseThrow(() -> new ResourceNotFoundException("Item " + itemId + " not found in pool " + id));
    }

    public boolean containsItem(String itemId) {
        return itemId != null && entries.containsKey(itemId);
    }

    /**
     * All items ordered by id.
     */
    public List<Item> items() {
        return entries.values().stream()
                .map(e -> e.item)
                .sorted(Comparator.comparing(Item::id))
                .toList();
    }

    /**
     * Items not yet administered, ordered by id.
     */
    public List<Item> unadministeredItems(Collection<String> administeredItemIds) {
        Set<String> administered = new HashSet<>(administeredItemIds);
        return items().stream()
                .filter(item -> !administered.contains(item.id()))
                .toList();
    }

    public int size() {
        return entries.size();
    }

    public long recordExposure(String itemId) {
        return entry(itemId).exposureCount.incrementAndGet();
    }

    public long exposureCount(String itemId) {
        return entry(itemId).exposureCount.get();
    }

    public long totalExposures() {
        return entries.values().stream()
                .mapToLong(e -> e.exposureCount.get())
                .sum();
    }

    public long registerSession() {
        return sessionsStarted.incrementAndGet();
    }

    public long sessionsStarted() {
        return sessionsStarted.get();
    }

    /**
     * Share of sessions on this pool in which the item was shown.
     */
    public double exposureRate(String itemId) {
        long sessions = sessionsStarted.get();
        return sessions == 0 ? 0.0 : (double) exposureCount(itemId) / sessions;
    }

    public void recordUsage(String itemId, boolean correct, Double responseTimeSeconds) {
        Entry entry = entry(itemId);
        entry.usageCount.incrementAndGet();
        if (correct) {
            entry.correctCount.incrementAndGet();
        }
        if (responseTimeSeconds != null) {
            entry.responseTimeTotal.add(responseTimeSeconds);
            entry.timedResponses.incrementAndGet();
        }
    }

    public ItemUsage usage(String itemId) {
        Entry entry = entry(itemId);
        long timed = entry.timedResponses.get();
        Double averageTime = timed == 0 ? null : entry.responseTimeTotal.sum() / timed;
        return new ItemUsage(entry.usageCount.get(), entry.correctCount.get(), averageTime);
    }

    private Entry entry(String itemId) {
        Entry entry = itemId == null ? null : entries.get(itemId);
        if (entry == null) {
            throw new ResourceNotFoundException("Item " + itemId + " not found in pool " + id);
        }
        return entry;
    }

    private static void checkParameters(Item item) {
        if (item.id() == null || item.id().isBlank()) {
            throw new InvalidItemParametersException(null, "Item id is required");
        }
        if (item.text() == null || item.text().isBlank()) {
            throw new InvalidItemParametersException(item.id(), "text is required");
        }
        if (item.type() == null) {
            throw new InvalidItemParametersException(item.id(), "type is required");
        }
        if (item.correctAnswer() == null || item.correctAnswer().isNull() || item.correctAnswer().isMissingNode()) {
            throw new InvalidItemParametersException(item.id(), "correct answer is required");
        }
        if (!Double.isFinite(item.difficulty())) {
            throw new InvalidItemParametersException(item.id(), "difficulty (b) must be a finite number");
        }
        if (!Double.isFinite(item.discrimination()) || item.discrimination() <= 0) {
            throw new InvalidItemParametersException(item.id(),
                    "discrimination (a) must be greater than 0, was " + item.discrimination());
        }
        if (!(item.guessing() >= 0 && item.guessing() < 1)) {
            throw new InvalidItemParametersException(item.id(),
                    "guessing (c) must be in [0, 1), was " + item.guessing());
        }
    }

    public record ItemUsage(long usageCount, long correctCount, Double averageResponseTimeSeconds) {
    }

    private static final class Entry {
        private final Item item;
        private final AtomicLong exposureCount = new AtomicLong();
        private final AtomicLong usageCount = new AtomicLong();
        private final AtomicLong correctCount = new AtomicLong();
        private final AtomicLong timedResponses = new AtomicLong();
        private final DoubleAdder responseTimeTotal = new DoubleAdder();

        private Entry(Item item) {
            this.item = item;
        }
    }
}
