package com.lumen.query.cache;

import java.time.Instant;

public final class CacheEntrySnapshot<V> {
    private final String key;
    private final V value;
    private final Instant insertedAt;
    private final Instant lastAccessedAt;
    private final Instant expiresAt;
    private final long hitCount;

    public CacheEntrySnapshot(
        String key,
        V value,
        Instant insertedAt,
        Instant lastAccessedAt,
        Instant expiresAt,
        long hitCount
    ) {
        this.key = key;
        this.value = value;
        this.insertedAt = insertedAt;
        this.lastAccessedAt = lastAccessedAt;
        this.expiresAt = expiresAt;
        this.hitCount = hitCount;
    }

    public String getKey() {
        return key;
    }

    public V getValue() {
        return value;
    }

    public Instant getInsertedAt() {
        return insertedAt;
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public long getHitCount() {
        return hitCount;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }
}
