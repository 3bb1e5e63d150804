package com.lumen.query.embed;

import com.lumen.query.cache.CacheStats;
import com.lumen.query.cache.LruCache;
import com.lumen.query.cache.QueryFingerprints;
import java.util.Optional;

public class CachingEmbeddingProvider implements EmbeddingProvider {
    private final EmbeddingProvider delegate;
    private final LruCache<float[]> cache;

    public CachingEmbeddingProvider(EmbeddingProvider delegate, int capacity) {
        this.delegate = delegate;
        this.cache = new LruCache<>(capacity);
    }

    @Override
    public float[] embed(String text) {
        String key = QueryFingerprints.normalizeQuery(text);
        Optional<float[]> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get().clone();
        }
        float[] vector = delegate.embed(text);
        cache.put(key, vector.clone());
        return vector;
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public void clear() {
        cache.clear();
    }
}
