package com.lumen.query.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.lumen.query.MutableClock;
import com.lumen.query.metrics.QueryMetrics;
import com.lumen.query.retrieval.SearchCandidate;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueryResultCacheTest {

    private static final float[] EMBEDDING = {0.6f, 0.8f, 0.0f};
    private static final String PARAMS = "qp:limit10";

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private QueryCacheProperties properties;
    private QueryResultCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-05-01T08:00:00Z");
        meterRegistry = new SimpleMeterRegistry();
        properties = new QueryCacheProperties();
        cache = new QueryResultCache(properties, new QueryMetrics(meterRegistry), clock);
    }

    @Test
    void keyDependsOnEveryResultShapingField() {
        QueryContext base = context("Machine  Learning", 10, null, Map.of());

        String key = cache.buildKey(base, "RRF");

        assertThat(key).startsWith("qe:");
        assertThat(cache.buildKey(context("machine learning", 10, null, Map.of()), "RRF")).isEqualTo(key);
        assertThat(cache.buildKey(context("machine learning", 5, null, Map.of()), "RRF")).isNotEqualTo(key);
        assertThat(cache.buildKey(context("machine learning", 10, 0.5, Map.of()), "RRF")).isNotEqualTo(key);
        assertThat(cache.buildKey(context("machine learning", 10, null, Map.of("lang", "en")), "RRF")).isNotEqualTo(key);
        assertThat(cache.buildKey(base, "WEIGHTED")).isNotEqualTo(key);
    }

    @Test
    void paramsKeyIgnoresQueryTextButNotParameters() {
        String params = cache.buildParamsKey(context("machine learning", 10, null, Map.of()), "RRF");

        assertThat(params).startsWith("qp:");
        assertThat(cache.buildParamsKey(context("deep learning", 10, null, Map.of()), "RRF")).isEqualTo(params);
        assertThat(cache.buildParamsKey(context("machine learning", 3, null, Map.of()), "RRF")).isNotEqualTo(params);
        assertThat(cache.buildParamsKey(context("machine learning", 10, null, Map.of("tenant", "b")), "RRF"))
            .isNotEqualTo(params);
    }

    @Test
    void servesExactAndSemanticHitsAndCountsThem() {
        String key = cache.buildKey(context("machine learning", 10, null, Map.of()), "RRF");
        cache.put(key, EMBEDDING, result("machine learning", List.of("machine", "learning")));

        assertThat(cache.getExact(key)).isPresent();
        assertThat(cache.getSemantic(new float[] {0.61f, 0.79f, 0.0f}, PARAMS)).isPresent();
        assertThat(cache.getSemantic(new float[] {0.0f, 0.0f, 1.0f}, PARAMS)).isEmpty();

        assertThat(meterRegistry.get("qe_cache_requests_total").tags("tier", "exact", "result", "hit").counter().count())
            .isEqualTo(1.0);
        assertThat(meterRegistry.get("qe_cache_requests_total").tags("tier", "semantic", "result", "miss").counter().count())
            .isEqualTo(1.0);
        assertThat(cache.stats()).containsOnlyKeys(QueryResultCache.TIER_EXACT, QueryResultCache.TIER_SEMANTIC);
    }

    @Test
    void semanticHitRequiresMatchingParameters() {
        QueryContext tenantA = context("machine learning", 10, null, Map.of("tenant", "a"));
        String paramsA = cache.buildParamsKey(tenantA, "RRF");
        String paramsB = cache.buildParamsKey(context("machine learning", 10, null, Map.of("tenant", "b")), "RRF");
        cache.put(cache.buildKey(tenantA, "RRF"), EMBEDDING,
            new CachedResult("machine learning", paramsA, List.of("machine", "learning"), List.of()));

        assertThat(cache.getSemantic(EMBEDDING, paramsA)).isPresent();
        assertThat(cache.getSemantic(EMBEDDING, paramsB)).isEmpty();
        assertThat(cache.findStale("qe:other", paramsB, List.of("machine", "learning"), EMBEDDING)).isEmpty();
    }

    @Test
    void staleLookupFallsBackFromExactToTermOverlapToSemantic() {
        String key = cache.buildKey(context("machine learning basics", 10, null, Map.of()), "RRF");
        CachedResult stored = result("machine learning basics", List.of("machine", "learning", "basics"));
        cache.put(key, EMBEDDING, stored);
        clock.advance(Duration.ofHours(2));

        assertThat(cache.getExact(key)).isEmpty();
        assertThat(cache.findStale(key, PARAMS, List.of(), null)).containsSame(stored);
        // 3 of 4 distinct terms shared
        assertThat(cache.findStale("qe:other", PARAMS, List.of("machine", "learning", "basics", "tutorial"), null))
            .containsSame(stored);
        assertThat(cache.findStale("qe:other", PARAMS, List.of("bread"), new float[] {0.6f, 0.79f, 0.01f}))
            .containsSame(stored);
        assertThat(cache.findStale("qe:other", PARAMS, List.of("bread"), new float[] {0.0f, 0.0f, 1.0f})).isEmpty();
    }

    @Test
    void staleLookupCanBeDisabled() {
        properties.getStale().setEnabled(false);
        String key = cache.buildKey(context("machine learning", 10, null, Map.of()), "RRF");
        cache.put(key, EMBEDDING, result("machine learning", List.of("machine", "learning")));

        assertThat(cache.findStale(key, PARAMS, List.of("machine", "learning"), EMBEDDING)).isEmpty();
    }

    @Test
    void cleanupAndClearEmptyBothTiers() {
        String key = cache.buildKey(context("machine learning", 10, null, Map.of()), "RRF");
        cache.put(key, EMBEDDING, result("machine learning", List.of("machine", "learning")));
        clock.advance(Duration.ofHours(1));

        assertThat(cache.cleanupExpired()).isEqualTo(2);

        cache.put(key, EMBEDDING, result("machine learning", List.of("machine", "learning")));
        cache.clear();
        assertThat(cache.stats().get(QueryResultCache.TIER_EXACT).getSize()).isZero();
        assertThat(cache.stats().get(QueryResultCache.TIER_SEMANTIC).getSize()).isZero();
    }

    private static QueryContext context(String query, int limit, Double lambda, Map<String, Object> filters) {
        return QueryContext.builder()
            .rawQuery(query)
            .normalizedQuery(query.trim().toLowerCase().replaceAll("\\s+", " "))
            .useCache(true)
            .rerankTopK(20)
            .diversityLambda(lambda)
            .resultLimit(limit)
            .filters(filters)
            .deadline(Instant.parse("2026-05-01T08:00:05Z"))
            .build();
    }

    private static CachedResult result(String query, List<String> terms) {
        return new CachedResult(query, PARAMS, terms, List.of(
            SearchCandidate.fused("doc1", "content", 0.9, 0.8, 1, 1, 0.032, 1)
        ));
    }
}
