package com.lumen.query.cache;

import java.time.Instant;

// mutable fields are only touched under the owning cache's lock
final class CacheEntry<V> {
    private final String key;
    private final V value;
    private final Instant insertedAt;
    private final Instant expiresAt;
    private Instant lastAccessedAt;
    private long hitCount;

    CacheEntry(String key, V value, Instant insertedAt, Instant expiresAt) {
        this.key = key;
        this.value = value;
        this.insertedAt = insertedAt;
        this.expiresAt = expiresAt;
        this.lastAccessedAt = insertedAt;
    }

    String getKey() {
        return key;
    }

    V getValue() {
        return value;
    }

    Instant getInsertedAt() {
        return insertedAt;
    }

    Instant getExpiresAt() {
        return expiresAt;
    }

    Instant getLastAccessedAt() {
        return lastAccessedAt;
    }

    long getHitCount() {
        return hitCount;
    }

    boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    void recordHit(Instant now) {
        lastAccessedAt = now;
        hitCount++;
    }

    CacheEntrySnapshot<V> snapshot(V copiedValue) {
        return new CacheEntrySnapshot<>(key, copiedValue, insertedAt, lastAccessedAt, expiresAt, hitCount);
    }
}
