package com.lumen.query.service;

import com.lumen.query.cache.CacheEntrySnapshot;
import com.lumen.query.cache.CacheStats;
import com.lumen.query.cache.LruCache;
import com.lumen.query.cache.QueryFingerprints;
import com.lumen.query.cache.SemanticCache;
import com.lumen.query.cache.SemanticHit;
import com.lumen.query.metrics.QueryMetrics;
import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

public class QueryResultCache {
    public static final String TIER_EXACT = "exact";
    public static final String TIER_SEMANTIC = "semantic";

    private final QueryCacheProperties properties;
    private final QueryMetrics metrics;
    private final LruCache<CachedResult> exact;
    private final SemanticCache<CachedResult> semantic;

    public QueryResultCache(QueryCacheProperties properties, QueryMetrics metrics, Clock clock) {
        this.properties = properties;
        this.metrics = metrics;
        QueryCacheProperties.Exact exactConfig = properties.getExact();
        QueryCacheProperties.Semantic semanticConfig = properties.getSemantic();
        // CachedResult is immutable, so the identity copier is enough
        this.exact = new LruCache<>(
            exactConfig.getCapacity(),
            ttl(exactConfig.getTtlMs()),
            clock,
            UnaryOperator.identity()
        );
        this.semantic = new SemanticCache<>(
            semanticConfig.getCapacity(),
            semanticConfig.getSimilarityThreshold(),
            ttl(semanticConfig.getTtlMs()),
            clock,
            UnaryOperator.identity()
        );
    }

    public String buildKey(QueryContext context, String fusionMethod) {
        Map<String, Object> fields = paramFields(context, fusionMethod);
        fields.put("q", context.getNormalizedQuery());
        String hash = QueryFingerprints.hashJson(fields);
        return hash == null ? null : "qe:" + hash;
    }

    // every key field except the query text; semantic hits must agree on these
    public String buildParamsKey(QueryContext context, String fusionMethod) {
        String hash = QueryFingerprints.hashJson(paramFields(context, fusionMethod));
        return hash == null ? null : "qp:" + hash;
    }

    public Optional<CachedResult> getExact(String key) {
        if (!properties.getExact().isEnabled() || key == null) {
            return Optional.empty();
        }
        Optional<CachedResult> hit = exact.get(key);
        metrics.recordCacheRequest(TIER_EXACT, hit.isPresent());
        return hit;
    }

    public Optional<SemanticHit<CachedResult>> getSemantic(float[] embedding, String params) {
        if (!properties.getSemantic().isEnabled() || embedding == null || params == null) {
            return Optional.empty();
        }
        Optional<SemanticHit<CachedResult>> hit = semantic.get(embedding, params);
        metrics.recordCacheRequest(TIER_SEMANTIC, hit.isPresent());
        return hit;
    }

    public void put(String key, float[] embedding, CachedResult result) {
        if (properties.getExact().isEnabled() && key != null) {
            exact.put(key, result);
        }
        if (properties.getSemantic().isEnabled() && embedding != null && key != null && result.getParams() != null) {
            semantic.put(key, result.getQuery(), result.getParams(), embedding, result);
        }
    }

    // last resort while both backends fail, expired entries included: exact key, then best
    // term overlap, then closest semantic entry; all restricted to the same params
    public Optional<CachedResult> findStale(String key, String params, List<String> terms, float[] embedding) {
        if (!properties.getStale().isEnabled()) {
            return Optional.empty();
        }
        if (key != null) {
            Optional<CachedResult> direct = exact.getStale(key);
            if (direct.isPresent()) {
                return direct;
            }
        }
        Optional<CachedResult> overlapping = bestTermOverlap(params, terms);
        if (overlapping.isPresent()) {
            return overlapping;
        }
        if (embedding != null && params != null) {
            return semantic.findBest(embedding, params, properties.getStale().getSemanticThreshold())
                .map(SemanticHit::getValue);
        }
        return Optional.empty();
    }

    public int cleanupExpired() {
        return exact.cleanupExpired() + semantic.cleanupExpired();
    }

    public void clear() {
        exact.clear();
        semantic.clear();
    }

    public Map<String, CacheStats> stats() {
        Map<String, CacheStats> stats = new LinkedHashMap<>();
        stats.put(TIER_EXACT, exact.stats());
        stats.put(TIER_SEMANTIC, semantic.stats());
        return stats;
    }

    public List<CacheEntrySnapshot<CachedResult>> topSemanticQueries(int limit) {
        return semantic.topQueries(limit);
    }

    private Optional<CachedResult> bestTermOverlap(String params, List<String> terms) {
        if (terms == null || terms.isEmpty() || params == null) {
            return Optional.empty();
        }
        Set<String> wanted = new HashSet<>(terms);
        CachedResult best = null;
        double bestOverlap = 0.0;
        // snapshot is taken under the cache lock; scoring happens here, outside it
        for (CacheEntrySnapshot<CachedResult> entry : exact.snapshot()) {
            if (!params.equals(entry.getValue().getParams())) {
                continue;
            }
            double overlap = jaccard(wanted, entry.getValue().getTerms());
            if (overlap > bestOverlap) {
                bestOverlap = overlap;
                best = entry.getValue();
            }
        }
        if (best == null || bestOverlap < properties.getStale().getMinTermOverlap()) {
            return Optional.empty();
        }
        return Optional.of(best);
    }

    private static double jaccard(Set<String> wanted, List<String> candidateTerms) {
        Set<String> union = new HashSet<>(wanted);
        union.addAll(candidateTerms);
        if (union.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        for (String term : new HashSet<>(candidateTerms)) {
            if (wanted.contains(term)) {
                intersection++;
            }
        }
        return (double) intersection / union.size();
    }

    private static Map<String, Object> paramFields(QueryContext context, String fusionMethod) {
        Map<String, Object> fields = new TreeMap<>();
        fields.put("limit", context.getResultLimit());
        fields.put("rerank_top_k", context.getRerankTopK());
        fields.put("lambda", context.getDiversityLambda());
        fields.put("fusion", fusionMethod);
        if (!context.getFilters().isEmpty()) {
            fields.put("filters", new TreeMap<>(context.getFilters()));
        }
        return fields;
    }

    private static Duration ttl(long ttlMs) {
        return ttlMs > 0 ? Duration.ofMillis(ttlMs) : null;
    }
}
