package com.lumen.query.cache;

import com.lumen.query.embed.VectorMath;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Bounded cache keyed by query embedding. A lookup hits when the cosine similarity between the
 * incoming embedding and the closest stored one reaches the threshold.
 *
 * <p>Lookups are a linear scan over every stored embedding. At the capacities this cache is
 * sized for (hundreds to low thousands of entries) the scan costs well under a millisecond and
 * needs no index structure; capacities far beyond that would call for an ANN index instead.
 * The scan runs outside the lock over a copied entry array; the lock is re-taken only to record
 * the hit and refresh recency.
 *
 * <p>Entries may carry a partition, the fingerprint of whatever besides the query shaped the
 * stored value. A partitioned lookup only considers entries of the same partition.
 */
public class SemanticCache<V> {
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.85;

    private final int capacity;
    private final double similarityThreshold;
    private final Duration ttl;
    private final Clock clock;
    private final UnaryOperator<V> copier;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, Slot<V>> slots;
    private long hits;
    private long misses;
    private long evictions;

    public SemanticCache(int capacity, double similarityThreshold) {
        this(capacity, similarityThreshold, null, Clock.systemUTC(), UnaryOperator.identity());
    }

    public SemanticCache(
        int capacity,
        double similarityThreshold,
        Duration ttl,
        Clock clock,
        UnaryOperator<V> copier
    ) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be within [0, 1]");
        }
        this.capacity = capacity;
        this.similarityThreshold = similarityThreshold;
        this.ttl = ttl;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.copier = copier == null ? UnaryOperator.identity() : copier;
        this.slots = new LinkedHashMap<>(Math.min(capacity, 1024), 0.75f, true);
    }

    public Optional<SemanticHit<V>> get(float[] embedding) {
        return get(embedding, null);
    }

    // only entries stored under an equal partition are candidates
    public Optional<SemanticHit<V>> get(float[] embedding, String partition) {
        Instant now = clock.instant();
        List<Slot<V>> copy = copySlots();
        Match<V> best = scan(copy, embedding, partition, true, now, false);
        lock.lock();
        try {
            if (best == null || best.similarity < similarityThreshold) {
                misses++;
                return Optional.empty();
            }
            Slot<V> current = slots.get(best.slot.entry.getKey());
            if (current != best.slot) {
                // replaced or evicted while scoring
                misses++;
                return Optional.empty();
            }
            current.entry.recordHit(now);
            hits++;
            return Optional.of(new SemanticHit<>(current.entry.getValue(), best.similarity, current.queryText));
        } finally {
            lock.unlock();
        }
    }

    // expired entries included; touches neither stats nor recency
    public Optional<SemanticHit<V>> findBest(float[] embedding, double minSimilarity) {
        return findBest(embedding, null, false, minSimilarity);
    }

    public Optional<SemanticHit<V>> findBest(float[] embedding, String partition, double minSimilarity) {
        return findBest(embedding, partition, true, minSimilarity);
    }

    public void put(String queryText, float[] embedding, V value) {
        put(queryText, queryText, null, embedding, value);
    }

    public void put(String key, String queryText, String partition, float[] embedding, V value) {
        if (key == null || embedding == null || embedding.length == 0 || value == null) {
            return;
        }
        V stored = copier.apply(value);
        float[] storedEmbedding = embedding.clone();
        Instant now = clock.instant();
        Instant expiresAt = ttl == null ? null : now.plus(ttl);
        lock.lock();
        try {
            slots.put(key, new Slot<>(new CacheEntry<>(key, stored, now, expiresAt), storedEmbedding, queryText, partition));
            Iterator<Map.Entry<String, Slot<V>>> iterator = slots.entrySet().iterator();
            while (slots.size() > capacity && iterator.hasNext()) {
                iterator.next();
                iterator.remove();
                evictions++;
            }
        } finally {
            lock.unlock();
        }
    }

    public int cleanupExpired() {
        if (ttl == null) {
            return 0;
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            int removed = 0;
            Iterator<Slot<V>> iterator = slots.values().iterator();
            while (iterator.hasNext()) {
                if (iterator.next().entry.isExpired(now)) {
                    iterator.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            slots.clear();
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(slots.size(), capacity, hits, misses, evictions);
        } finally {
            lock.unlock();
        }
    }

    public List<CacheEntrySnapshot<V>> topQueries(int limit) {
        List<CacheEntrySnapshot<V>> snapshots = new ArrayList<>();
        lock.lock();
        try {
            for (Slot<V> slot : slots.values()) {
                snapshots.add(slot.entry.snapshot(slot.entry.getValue()));
            }
        } finally {
            lock.unlock();
        }
        snapshots.sort(Comparator.comparingLong(CacheEntrySnapshot<V>::getHitCount).reversed()
            .thenComparing(CacheEntrySnapshot::getKey));
        return List.copyOf(snapshots.subList(0, Math.min(Math.max(0, limit), snapshots.size())));
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public int getCapacity() {
        return capacity;
    }

    private List<Slot<V>> copySlots() {
        lock.lock();
        try {
            return new ArrayList<>(slots.values());
        } finally {
            lock.unlock();
        }
    }

    private Optional<SemanticHit<V>> findBest(float[] embedding, String partition, boolean matchPartition, double minSimilarity) {
        Match<V> best = scan(copySlots(), embedding, partition, matchPartition, clock.instant(), true);
        if (best == null || best.similarity < minSimilarity) {
            return Optional.empty();
        }
        return Optional.of(new SemanticHit<>(best.slot.entry.getValue(), best.similarity, best.slot.queryText));
    }

    private Match<V> scan(
        List<Slot<V>> candidates,
        float[] embedding,
        String partition,
        boolean matchPartition,
        Instant now,
        boolean includeExpired
    ) {
        if (embedding == null || embedding.length == 0) {
            return null;
        }
        Match<V> best = null;
        for (Slot<V> slot : candidates) {
            if (matchPartition && !Objects.equals(partition, slot.partition)) {
                continue;
            }
            if (!includeExpired && slot.entry.isExpired(now)) {
                continue;
            }
            double similarity = VectorMath.cosine(embedding, slot.embedding);
            if (best == null || similarity > best.similarity) {
                best = new Match<>(slot, similarity);
            }
        }
        return best;
    }

    private static final class Slot<V> {
        private final CacheEntry<V> entry;
        private final float[] embedding;
        private final String queryText;
        private final String partition;

        private Slot(CacheEntry<V> entry, float[] embedding, String queryText, String partition) {
            this.entry = entry;
            this.embedding = embedding;
            this.queryText = queryText;
            this.partition = partition;
        }
    }
    private static final class Match<V> {
        private final Slot<V> slot;
        private final double similarity;

        private Match(Slot<V> slot, double similarity) {
            this.slot = slot;
            this.similarity = similarity;
        }
    }
}
