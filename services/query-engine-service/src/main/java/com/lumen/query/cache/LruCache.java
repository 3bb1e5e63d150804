package com.lumen.query.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

// expired entries miss on get but stay readable through getStale until evicted or cleaned up
public class LruCache<V> {
    private final int capacity;
    private final Duration ttl;
    private final Clock clock;
    private final UnaryOperator<V> copier;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, CacheEntry<V>> entries;
    private long hits;
    private long misses;
    private long evictions;

    public LruCache(int capacity) {
        this(capacity, null, Clock.systemUTC(), UnaryOperator.identity());
    }

    public LruCache(int capacity, Duration ttl, Clock clock, UnaryOperator<V> copier) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.capacity = capacity;
        this.ttl = ttl;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.copier = copier == null ? UnaryOperator.identity() : copier;
        this.entries = new LinkedHashMap<>(Math.min(capacity, 1024), 0.75f, true);
    }

    public Optional<V> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                // kept for getStale until evicted or cleaned up
                misses++;
                return Optional.empty();
            }
            entry.recordHit(now);
            hits++;
            return Optional.of(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    public Optional<V> getStale(String key) {
        if (key == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            return entry == null ? Optional.empty() : Optional.of(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    public void put(String key, V value) {
        if (key == null || value == null) {
            return;
        }
        V stored = copier.apply(value);
        Instant now = clock.instant();
        Instant expiresAt = ttl == null ? null : now.plus(ttl);
        lock.lock();
        try {
            entries.put(key, new CacheEntry<>(key, stored, now, expiresAt));
            evictIfNeeded();
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String key) {
        if (key == null) {
            return false;
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            return entry != null && !entry.isExpired(now);
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
            Iterator<Map.Entry<String, CacheEntry<V>>> iterator = entries.entrySet().iterator();
            while (iterator.hasNext()) {
                if (iterator.next().getValue().isExpired(now)) {
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
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(entries.size(), capacity, hits, misses, evictions);
        } finally {
            lock.unlock();
        }
    }

    public List<CacheEntrySnapshot<V>> snapshot() {
        lock.lock();
        try {
            List<CacheEntrySnapshot<V>> copy = new ArrayList<>(entries.size());
            for (CacheEntry<V> entry : entries.values()) {
                copy.add(entry.snapshot(entry.getValue()));
            }
            return copy;
        } finally {
            lock.unlock();
        }
    }

    private void evictIfNeeded() {
        Iterator<Map.Entry<String, CacheEntry<V>>> iterator = entries.entrySet().iterator();
        while (entries.size() > capacity && iterator.hasNext()) {
            iterator.next();
            iterator.remove();
            evictions++;
        }
    }
}
