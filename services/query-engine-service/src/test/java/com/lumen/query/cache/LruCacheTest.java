package com.lumen.query.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lumen.query.MutableClock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.Test;

class LruCacheTest {

    @Test
    void evictsLeastRecentlyUsedEntry() {
        LruCache<String> cache = new LruCache<>(2);
        cache.put("a", "alpha");
        cache.put("b", "beta");
        assertThat(cache.get("a")).contains("alpha");

        cache.put("c", "gamma");

        assertThat(cache.contains("a")).isTrue();
        assertThat(cache.contains("b")).isFalse();
        assertThat(cache.contains("c")).isTrue();
        assertThat(cache.stats().getEvictions()).isEqualTo(1);
    }

    @Test
    void tracksHitsAndMisses() {
        LruCache<String> cache = new LruCache<>(4);
        cache.put("a", "alpha");

        cache.get("a");
        cache.get("a");
        cache.get("missing");

        CacheStats stats = cache.stats();
        assertThat(stats.getHits()).isEqualTo(2);
        assertThat(stats.getMisses()).isEqualTo(1);
        assertThat(stats.getHitRate()).isEqualTo(2.0 / 3.0);
        assertThat(stats.getUtilization()).isEqualTo(0.25);
    }

    @Test
    void expiredEntriesMissButStayReachableAsStale() {
        MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        LruCache<String> cache = new LruCache<>(4, Duration.ofSeconds(10), clock, UnaryOperator.identity());
        cache.put("q", "answer");

        clock.advance(Duration.ofSeconds(11));

        assertThat(cache.get("q")).isEmpty();
        assertThat(cache.contains("q")).isFalse();
        assertThat(cache.getStale("q")).contains("answer");
        assertThat(cache.cleanupExpired()).isEqualTo(1);
        assertThat(cache.getStale("q")).isEmpty();
    }

    @Test
    void cleanupRemovesOnlyExpiredEntries() {
        MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        LruCache<String> cache = new LruCache<>(4, Duration.ofSeconds(10), clock, UnaryOperator.identity());
        cache.put("old", "1");
        clock.advance(Duration.ofSeconds(8));
        cache.put("new", "2");
        clock.advance(Duration.ofSeconds(5));

        assertThat(cache.cleanupExpired()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("new")).contains("2");
    }

    @Test
    void appliesCopierOnPut() {
        LruCache<List<String>> cache = new LruCache<>(2, null, null, List::copyOf);
        List<String> original = new ArrayList<>(List.of("doc1"));
        cache.put("k", original);
        original.add("doc2");

        assertThat(cache.get("k")).hasValueSatisfying(value -> assertThat(value).containsExactly("doc1"));
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new LruCache<String>(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void staysWithinCapacityUnderConcurrentWriters() throws Exception {
        LruCache<Integer> cache = new LruCache<>(100);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int offset = t * 1000;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 1000; i++) {
                        cache.put("k" + (offset + i), i);
                        cache.get("k" + (offset + i / 2));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(cache.size()).isEqualTo(100);
        assertThat(cache.stats().getEvictions()).isEqualTo(8000 - 100);
    }
}
