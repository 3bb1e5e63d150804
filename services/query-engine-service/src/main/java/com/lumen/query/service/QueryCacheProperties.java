package com.lumen.query.service;

import com.lumen.query.cache.SemanticCache;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "query.cache")
public class QueryCacheProperties {
    private Exact exact = new Exact();
    private Semantic semantic = new Semantic();
    private Stale stale = new Stale();
    private long cleanupIntervalMs = 60000;

    public Exact getExact() {
        return exact;
    }

    public void setExact(Exact exact) {
        this.exact = exact;
    }

    public Semantic getSemantic() {
        return semantic;
    }

    public void setSemantic(Semantic semantic) {
        this.semantic = semantic;
    }

    public Stale getStale() {
        return stale;
    }

    public void setStale(Stale stale) {
        this.stale = stale;
    }

    public long getCleanupIntervalMs() {
        return cleanupIntervalMs;
    }

    public void setCleanupIntervalMs(long cleanupIntervalMs) {
        this.cleanupIntervalMs = cleanupIntervalMs;
    }

    public static class Exact {
        private boolean enabled = true;
        private int capacity = 1000;
        private long ttlMs = 300000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public long getTtlMs() {
            return ttlMs;
        }

        public void setTtlMs(long ttlMs) {
            this.ttlMs = ttlMs;
        }
    }

    public static class Semantic {
        private boolean enabled = true;
        private int capacity = 500;
        private double similarityThreshold = SemanticCache.DEFAULT_SIMILARITY_THRESHOLD;
        private long ttlMs = 600000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public double getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }

        public long getTtlMs() {
            return ttlMs;
        }

        public void setTtlMs(long ttlMs) {
            this.ttlMs = ttlMs;
        }
    }

    public static class Stale {
        private boolean enabled = true;
        private double minTermOverlap = 0.5;
        private double semanticThreshold = 0.75;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getMinTermOverlap() {
            return minTermOverlap;
        }

        public void setMinTermOverlap(double minTermOverlap) {
            this.minTermOverlap = minTermOverlap;
        }

        public double getSemanticThreshold() {
            return semanticThreshold;
        }

        public void setSemanticThreshold(double semanticThreshold) {
            this.semanticThreshold = semanticThreshold;
        }
    }
}
