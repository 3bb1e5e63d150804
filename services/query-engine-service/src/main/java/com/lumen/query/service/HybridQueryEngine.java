package com.lumen.query.service;

import com.lumen.query.api.EngineStatus;
import com.lumen.query.api.InvalidQueryException;
import com.lumen.query.api.QueryRequest;
import com.lumen.query.api.QueryResponse;
import com.lumen.query.api.QueryTimings;
import com.lumen.query.api.SearchUnavailableException;
import com.lumen.query.api.ServedBy;
import com.lumen.query.backend.BackendHit;
import com.lumen.query.backend.KeywordBackend;
import com.lumen.query.backend.VectorBackend;
import com.lumen.query.cache.QueryFingerprints;
import com.lumen.query.cache.SemanticHit;
import com.lumen.query.embed.EmbeddingProvider;
import com.lumen.query.embed.EmbeddingUnavailableException;
import com.lumen.query.expansion.QueryExpander;
import com.lumen.query.merge.RrfFusion;
import com.lumen.query.merge.WeightedFusion;
import com.lumen.query.metrics.QueryMetrics;
import com.lumen.query.ranking.RankingProperties;
import com.lumen.query.ranking.Reranker;
import com.lumen.query.resilience.CircuitBreaker;
import com.lumen.query.resilience.ResilienceRegistry;
import com.lumen.query.retrieval.FusionMethod;
import com.lumen.query.retrieval.FusionStrategy;
import com.lumen.query.retrieval.SearchCandidate;
import com.lumen.query.text.Tokenizer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class HybridQueryEngine {
    private static final Logger log = LoggerFactory.getLogger(HybridQueryEngine.class);

    private static final String VECTOR_OPERATION = "vector_query";

    private final QueryEngineProperties properties;
    private final RankingProperties rankingProperties;
    private final QueryResultCache resultCache;
    private final EmbeddingProvider embeddingProvider;
    private final VectorBackend vectorBackend;
    private final KeywordBackend keywordBackend;
    private final QueryExpander queryExpander;
    private final Reranker reranker;
    private final ResilienceRegistry resilienceRegistry;
    private final QueryMetrics metrics;
    private final ExecutorService searchExecutor;
    private final Clock clock;
    private final FusionMethod fusionMethod;
    private final FusionStrategy fusionStrategy;
    private final AtomicReference<Instant> lastDegradedAt = new AtomicReference<>();

    public HybridQueryEngine(
        QueryEngineProperties properties,
        RankingProperties rankingProperties,
        QueryResultCache resultCache,
        EmbeddingProvider embeddingProvider,
        VectorBackend vectorBackend,
        KeywordBackend keywordBackend,
        QueryExpander queryExpander,
        Reranker reranker,
        ResilienceRegistry resilienceRegistry,
        QueryMetrics metrics,
        ExecutorService searchExecutor,
        Clock clock
    ) {
        this.properties = properties;
        this.rankingProperties = rankingProperties;
        this.resultCache = resultCache;
        this.embeddingProvider = embeddingProvider;
        this.vectorBackend = vectorBackend;
        this.keywordBackend = keywordBackend;
        this.queryExpander = queryExpander;
        this.reranker = reranker;
        this.resilienceRegistry = resilienceRegistry;
        this.metrics = metrics;
        this.searchExecutor = searchExecutor;
        this.clock = clock;
        this.fusionMethod = FusionMethod.fromString(properties.getFusionMethod());
        this.fusionStrategy = fusionMethod == FusionMethod.WEIGHTED
            ? new WeightedFusion(properties.getWeightedAlpha())
            : new RrfFusion();
    }

    public QueryResponse search(QueryRequest request) {
        long started = System.nanoTime();
        QueryContext context = buildContext(request);
        try {
            QueryResponse response = execute(context, started);
            metrics.recordQuery(outcome(response), Duration.ofNanos(System.nanoTime() - started));
            return response;
        } catch (RuntimeException e) {
            metrics.recordQuery(QueryMetrics.OUTCOME_ERROR, Duration.ofNanos(System.nanoTime() - started));
            throw e;
        }
    }

    public int warmUp(List<String> queries) {
        if (queries == null || queries.isEmpty()) {
            return 0;
        }
        int warmed = 0;
        for (String query : queries) {
            try {
                QueryResponse response = search(QueryRequest.of(query));
                if (!response.isDegradedMode() && !response.getResults().isEmpty()) {
                    warmed++;
                }
            } catch (InvalidQueryException | SearchUnavailableException e) {
                log.warn("cache_warm_skipped query={} reason={}", query, e.getMessage());
            }
        }
        log.info("cache_warm_completed requested={} warmed={}", queries.size(), warmed);
        return warmed;
    }

    public EngineStatus status() {
        return new EngineStatus(resilienceRegistry.snapshots(), resultCache.stats(), lastDegradedAt.get());
    }

    public void clearCaches() {
        resultCache.clear();
    }

    // fallback order: hybrid, keyword only, stale cache, SearchUnavailableException
    private QueryResponse execute(QueryContext initial, long started) {
        List<String> warnings = new ArrayList<>();
        String cacheKey = resultCache.buildKey(initial, fusionMethod.name());
        String paramsKey = resultCache.buildParamsKey(initial, fusionMethod.name());
        Future<float[]> embeddingFuture = submitEmbedding(initial);
        float[] embedding = null;
        boolean embedded = false;

        if (initial.isUseCache()) {
            embedding = awaitEmbedding(embeddingFuture, initial, warnings);
            embedded = true;
            Optional<QueryResponse> cached = serveFromCache(initial, cacheKey, paramsKey, embedding, started);
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        QueryContext context = initial.withExpandedTerms(expand(initial, warnings));

        long keywordStarted = System.nanoTime();
        Future<List<BackendHit>> keywordFuture = searchExecutor.submit(
            () -> keywordBackend.query(context.getExpandedTerms(), properties.getKeywordTopK())
        );
        if (!embedded) {
            embedding = awaitEmbedding(embeddingFuture, context, warnings);
        }
        float[] queryEmbedding = embedding;
        long vectorStarted = System.nanoTime();
        Future<List<BackendHit>> vectorFuture = queryEmbedding == null
            ? null
            : searchExecutor.submit(() -> queryVector(queryEmbedding, context));

        StageResult<List<BackendHit>> vector = vectorFuture == null
            ? StageResult.<List<BackendHit>>failed(new EmbeddingUnavailableException("embedding_unavailable"), 0L)
            : await(vectorFuture, context.getDeadline(), vectorStarted);
        StageResult<List<BackendHit>> keyword = await(keywordFuture, context.getDeadline(), keywordStarted);
        if (vectorFuture != null) {
            metrics.recordVectorBackend(
                vector.isSuccess() ? QueryMetrics.OUTCOME_SUCCESS : QueryMetrics.OUTCOME_ERROR,
                Duration.ofMillis(vector.elapsedMs)
            );
        }

        if (!vector.isSuccess() && !keyword.isSuccess()) {
            return serveStale(context, cacheKey, paramsKey, embedding, vector, keyword, warnings, started);
        }

        ServedBy servedBy;
        boolean degraded;
        if (vector.isSuccess() && keyword.isSuccess()) {
            servedBy = ServedBy.HYBRID;
            degraded = false;
        } else if (vector.isSuccess()) {
            servedBy = ServedBy.VECTOR_ONLY;
            degraded = false;
            warnings.add("keyword_backend_failed");
            log.warn("keyword_backend_failed query_hash={} error={}", hashQuery(context), describe(keyword.error));
        } else {
            servedBy = ServedBy.KEYWORD_ONLY;
            degraded = true;
            warnings.add("vector_backend_failed");
            markDegraded();
            log.warn("vector_backend_failed_degrading query_hash={} error={}", hashQuery(context), describe(vector.error));
        }

        long fusionStarted = System.nanoTime();
        List<SearchCandidate> fused = fusionStrategy.fuse(
            vector.isSuccess() ? vector.value : List.of(),
            keyword.isSuccess() ? keyword.value : List.of(),
            properties.getRrfK()
        );
        long fusionMs = elapsedMs(fusionStarted);

        long rerankStarted = System.nanoTime();
        List<SearchCandidate> ranked = reranker.rerank(context.getRawQuery(), fused, context.getRerankTopK());
        ranked = reranker.diversify(ranked, context.getDiversityLambda());
        if (properties.getNearDuplicateThreshold() != null) {
            ranked = reranker.filterNearDuplicates(ranked, properties.getNearDuplicateThreshold());
        }
        long rerankMs = elapsedMs(rerankStarted);

        List<SearchCandidate> results = truncate(ranked, context.getResultLimit());
        if (!degraded && !results.isEmpty() && context.isUseCache()) {
            writeThrough(cacheKey, paramsKey, embedding, context, results);
        }

        QueryTimings timings = new QueryTimings(
            elapsedMs(started),
            vector.elapsedMs,
            keyword.elapsedMs,
            fusionMs,
            rerankMs
        );
        log.debug("query_served served_by={} results={} degraded={} total_ms={}",
            servedBy, results.size(), degraded, timings.getTotalMs());
        return new QueryResponse(results, degraded, servedBy, context.getExpandedTerms(), timings, warnings);
    }

    private QueryContext buildContext(QueryRequest request) {
        if (request == null || request.getQuery() == null || request.getQuery().isBlank()) {
            throw new InvalidQueryException("query must not be blank");
        }
        String query = request.getQuery().trim();
        if (query.length() > properties.getMaxQueryLength()) {
            throw new InvalidQueryException("query exceeds " + properties.getMaxQueryLength() + " characters");
        }
        int limit = request.getLimit() == null ? properties.getDefaultLimit() : request.getLimit();
        if (limit < 1 || limit > properties.getMaxResultLimit()) {
            throw new InvalidQueryException("limit must be within [1, " + properties.getMaxResultLimit() + "]");
        }
        int rerankTopK = request.getRerankTopK() == null ? rankingProperties.getDefaultTopK() : request.getRerankTopK();
        if (rerankTopK < 0) {
            throw new InvalidQueryException("rerankTopK must not be negative");
        }
        Double lambda = request.getDiversityLambda();
        if (lambda != null && (lambda.isNaN() || lambda < 0.0 || lambda > 1.0)) {
            throw new InvalidQueryException("diversityLambda must be within [0, 1]");
        }
        Map<String, Object> filters = request.getFilters() == null ? Map.of() : request.getFilters();
        for (Map.Entry<String, Object> entry : filters.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new InvalidQueryException("filters must not contain null keys or values");
            }
        }
        return QueryContext.builder()
            .rawQuery(query)
            .normalizedQuery(QueryFingerprints.normalizeQuery(query))
            .useCache(request.isUseCache())
            .rerankTopK(rerankTopK)
            .diversityLambda(lambda)
            .resultLimit(limit)
            .filters(filters)
            .deadline(clock.instant().plusMillis(properties.getRequestTimeoutMs()))
            .build();
    }

    // single breaker-guarded attempt, never retried; callers bound the wait by embedding-timeout-ms
    private Future<float[]> submitEmbedding(QueryContext context) {
        CircuitBreaker breaker = resilienceRegistry.getEmbeddingBreaker();
        return searchExecutor.submit(() -> breaker.call(() -> embeddingProvider.embed(context.getRawQuery())));
    }

    private float[] awaitEmbedding(Future<float[]> future, QueryContext context, List<String> warnings) {
        Instant budget = clock.instant().plusMillis(properties.getEmbeddingTimeoutMs());
        Instant deadline = budget.isBefore(context.getDeadline()) ? budget : context.getDeadline();
        StageResult<float[]> result = await(future, deadline, System.nanoTime());
        if (result.isSuccess()) {
            return result.value;
        }
        warnings.add("embedding_unavailable");
        log.warn("query_embedding_failed query_hash={} error={}", hashQuery(context), describe(result.error));
        return null;
    }

    private List<String> expand(QueryContext context, List<String> warnings) {
        try {
            List<String> terms = queryExpander.expand(context.getRawQuery());
            if (!terms.isEmpty()) {
                return terms;
            }
        } catch (RuntimeException e) {
            warnings.add("expansion_failed");
            log.warn("query_expansion_failed query_hash={} error={}", hashQuery(context), e.toString());
        }
        return Tokenizer.tokenize(context.getRawQuery());
    }

    private List<BackendHit> queryVector(float[] embedding, QueryContext context) {
        CircuitBreaker breaker = resilienceRegistry.getVectorBreaker();
        return resilienceRegistry.getRetryExecutor().execute(
            VECTOR_OPERATION,
            () -> breaker.call(() -> vectorBackend.query(embedding, properties.getVectorTopK(), context.getFilters()))
        );
    }

    private Optional<QueryResponse> serveFromCache(
        QueryContext context,
        String cacheKey,
        String paramsKey,
        float[] embedding,
        long started
    ) {
        try {
            Optional<SemanticHit<CachedResult>> semanticHit = resultCache.getSemantic(embedding, paramsKey);
            Optional<CachedResult> hit = semanticHit.map(SemanticHit::getValue);
            if (semanticHit.isPresent()) {
                log.debug("semantic_cache_hit similarity={} matched_query_hash={}",
                    semanticHit.get().getSimilarity(), QueryFingerprints.sha256(semanticHit.get().getMatchedQuery()));
            } else {
                hit = resultCache.getExact(cacheKey);
            }
            return hit.map(cached -> new QueryResponse(
                truncate(cached.getResults(), context.getResultLimit()),
                false,
                ServedBy.CACHE,
                cached.getTerms(),
                QueryTimings.total(elapsedMs(started)),
                List.of()
            ));
        } catch (RuntimeException e) {
            log.warn("result_cache_read_failed error={}", e.toString());
            return Optional.empty();
        }
    }

    private QueryResponse serveStale(
        QueryContext context,
        String cacheKey,
        String paramsKey,
        float[] embedding,
        StageResult<List<BackendHit>> vector,
        StageResult<List<BackendHit>> keyword,
        List<String> warnings,
        long started
    ) {
        Optional<CachedResult> stale;
        try {
            stale = resultCache.findStale(cacheKey, paramsKey, context.getExpandedTerms(), embedding);
        } catch (RuntimeException e) {
            log.warn("stale_cache_read_failed error={}", e.toString());
            stale = Optional.empty();
        }
        if (stale.isEmpty()) {
            log.warn("search_unavailable query_hash={} vector_error={} keyword_error={}",
                hashQuery(context), describe(vector.error), describe(keyword.error));
            SearchUnavailableException error = new SearchUnavailableException(
                "Vector and keyword backends failed and no cached results are available",
                vector.error
            );
            if (keyword.error != null) {
                error.addSuppressed(keyword.error);
            }
            throw error;
        }
        markDegraded();
        warnings.add("vector_backend_failed");
        warnings.add("keyword_backend_failed");
        warnings.add("served_stale_cache");
        log.warn("serving_stale_cache query_hash={} matched_query_hash={}",
            hashQuery(context), QueryFingerprints.sha256(stale.get().getQuery()));
        return new QueryResponse(
            truncate(stale.get().getResults(), context.getResultLimit()),
            true,
            ServedBy.STALE_CACHE,
            context.getExpandedTerms(),
            new QueryTimings(elapsedMs(started), vector.elapsedMs, keyword.elapsedMs, 0L, 0L),
            warnings
        );
    }

    private void writeThrough(
        String cacheKey,
        String paramsKey,
        float[] embedding,
        QueryContext context,
        List<SearchCandidate> results
    ) {
        try {
            CachedResult result = new CachedResult(context.getNormalizedQuery(), paramsKey, context.getExpandedTerms(), results);
            resultCache.put(cacheKey, embedding, result);
        } catch (RuntimeException e) {
            log.warn("result_cache_write_failed error={}", e.toString());
        }
    }

    private <T> StageResult<T> await(Future<T> future, Instant deadline, long startedNanos) {
        long remainingMs = Math.max(0L, Duration.between(clock.instant(), deadline).toMillis());
        try {
            T value = future.get(remainingMs, TimeUnit.MILLISECONDS);
            return StageResult.success(value, elapsedMs(startedNanos));
        } catch (TimeoutException e) {
            // interrupting the worker marks the attempt as caller-cancelled, so breakers ignore it
            future.cancel(true);
            return StageResult.failed(new TimeoutException("deadline exceeded"), elapsedMs(startedNanos));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return StageResult.failed(e, elapsedMs(startedNanos));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return StageResult.failed(cause, elapsedMs(startedNanos));
        }
    }

    private static List<SearchCandidate> truncate(List<SearchCandidate> candidates, int limit) {
        List<SearchCandidate> truncated = new ArrayList<>(Math.min(limit, candidates.size()));
        for (int i = 0; i < candidates.size() && i < limit; i++) {
            truncated.add(candidates.get(i).withRank(i + 1));
        }
        return truncated;
    }

    private static String outcome(QueryResponse response) {
        if (response.isDegradedMode()) {
            return QueryMetrics.OUTCOME_DEGRADED;
        }
        return response.getServedBy() == ServedBy.VECTOR_ONLY ? QueryMetrics.OUTCOME_PARTIAL : QueryMetrics.OUTCOME_SUCCESS;
    }

    private void markDegraded() {
        lastDegradedAt.set(clock.instant());
    }

    private static String hashQuery(QueryContext context) {
        String hash = QueryFingerprints.sha256(context.getNormalizedQuery());
        return hash == null ? "none" : hash.substring(0, 12);
    }

    private static String describe(Throwable error) {
        return error == null ? "none" : error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static final class StageResult<T> {
        private final T value;
        private final Throwable error;
        private final long elapsedMs;

        private StageResult(T value, Throwable error, long elapsedMs) {
            this.value = value;
            this.error = error;
            this.elapsedMs = elapsedMs;
        }

        static <T> StageResult<T> success(T value, long elapsedMs) {
            return new StageResult<>(value, null, elapsedMs);
        }

        static <T> StageResult<T> failed(Throwable error, long elapsedMs) {
            return new StageResult<>(null, error, elapsedMs);
        }

        boolean isSuccess() {
            return error == null;
        }
    }
}
