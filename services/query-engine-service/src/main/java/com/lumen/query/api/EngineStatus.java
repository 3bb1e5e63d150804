package com.lumen.query.api;

import com.lumen.query.cache.CacheStats;
import com.lumen.query.resilience.CircuitBreakerSnapshot;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class EngineStatus {
    private final List<CircuitBreakerSnapshot> breakers;
    private final Map<String, CacheStats> caches;
    private final Instant lastDegradedAt;

    public EngineStatus(List<CircuitBreakerSnapshot> breakers, Map<String, CacheStats> caches, Instant lastDegradedAt) {
        this.breakers = List.copyOf(breakers);
        this.caches = Map.copyOf(caches);
        this.lastDegradedAt = lastDegradedAt;
    }

    public List<CircuitBreakerSnapshot> getBreakers() {
        return breakers;
    }

    public Map<String, CacheStats> getCaches() {
        return caches;
    }

    public Instant getLastDegradedAt() {
        return lastDegradedAt;
    }
}
