package com.lumen.query.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.lumen.query.MutableClock;
import java.time.Duration;
import java.util.List;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.Test;

class SemanticCacheTest {

    private static final float[] ML = {1.0f, 0.0f, 0.0f};
    private static final float[] ML_CLOSE = {0.95f, 0.1f, 0.0f};
    private static final float[] COOKING = {0.0f, 0.0f, 1.0f};

    @Test
    void hitsWhenSimilarityReachesThreshold() {
        SemanticCache<String> cache = new SemanticCache<>(10, 0.85);
        cache.put("machine learning", ML, "ml-results");

        assertThat(cache.get(ML_CLOSE)).hasValueSatisfying(hit -> {
            assertThat(hit.getValue()).isEqualTo("ml-results");
            assertThat(hit.getMatchedQuery()).isEqualTo("machine learning");
            assertThat(hit.getSimilarity()).isGreaterThan(0.85);
        });
        assertThat(cache.get(COOKING)).isEmpty();
        assertThat(cache.stats().getHits()).isEqualTo(1);
        assertThat(cache.stats().getMisses()).isEqualTo(1);
    }

    @Test
    void returnsClosestOfSeveralMatches() {
        SemanticCache<String> cache = new SemanticCache<>(10, 0.5);
        cache.put("close", ML_CLOSE, "close");
        cache.put("exact", ML, "exact");

        assertThat(cache.get(ML)).hasValueSatisfying(hit -> assertThat(hit.getValue()).isEqualTo("exact"));
    }

    @Test
    void evictsLeastRecentlyUsedSlot() {
        SemanticCache<String> cache = new SemanticCache<>(2, 0.9);
        cache.put("ml", ML, "ml");
        cache.put("cooking", COOKING, "cooking");
        cache.get(ML);
        cache.put("middle", new float[] {0.0f, 1.0f, 0.0f}, "middle");

        assertThat(cache.get(COOKING)).isEmpty();
        assertThat(cache.get(ML)).isPresent();
        assertThat(cache.stats().getEvictions()).isEqualTo(1);
    }

    @Test
    void expiredSlotsOnlyServeStaleLookups() {
        MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        SemanticCache<String> cache = new SemanticCache<>(4, 0.85, Duration.ofMinutes(1), clock, UnaryOperator.identity());
        cache.put("machine learning", ML, "ml-results");
        clock.advance(Duration.ofMinutes(2));

        assertThat(cache.get(ML)).isEmpty();
        assertThat(cache.findBest(ML_CLOSE, 0.75)).hasValueSatisfying(hit -> assertThat(hit.getValue()).isEqualTo("ml-results"));
        assertThat(cache.cleanupExpired()).isEqualTo(1);
        assertThat(cache.findBest(ML, 0.0)).isEmpty();
    }

    @Test
    void storedEmbeddingIsIsolatedFromCaller() {
        SemanticCache<String> cache = new SemanticCache<>(4, 0.99);
        float[] embedding = ML.clone();
        cache.put("ml", embedding, "ml");
        embedding[0] = 0.0f;
        embedding[2] = 1.0f;

        assertThat(cache.get(ML)).isPresent();
    }

    @Test
    void topQueriesOrdersByHitCount() {
        SemanticCache<String> cache = new SemanticCache<>(4, 0.9);
        cache.put("ml", ML, "ml");
        cache.put("cooking", COOKING, "cooking");
        cache.get(COOKING);
        cache.get(COOKING);
        cache.get(ML);

        List<CacheEntrySnapshot<String>> top = cache.topQueries(5);

        assertThat(top).extracting(CacheEntrySnapshot::getKey).containsExactly("cooking", "ml");
        assertThat(top.get(0).getHitCount()).isEqualTo(2);
    }
}
