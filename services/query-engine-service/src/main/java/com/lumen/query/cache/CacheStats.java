package com.lumen.query.cache;

public final class CacheStats {
    private final int size;
    private final int capacity;
    private final long hits;
    private final long misses;
    private final long evictions;

    public CacheStats(int size, int capacity, long hits, long misses, long evictions) {
        this.size = size;
        this.capacity = capacity;
        this.hits = hits;
        this.misses = misses;
        this.evictions = evictions;
    }

    public int getSize() {
        return size;
    }

    public int getCapacity() {
        return capacity;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public long getEvictions() {
        return evictions;
    }

    public double getHitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    public double getUtilization() {
        return capacity == 0 ? 0.0 : (double) size / capacity;
    }
}
