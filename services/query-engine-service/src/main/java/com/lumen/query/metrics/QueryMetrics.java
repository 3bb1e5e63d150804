package com.lumen.query.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;

public class QueryMetrics {
    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_ERROR = "error";
    public static final String OUTCOME_DEGRADED = "degraded";
    public static final String OUTCOME_PARTIAL = "partial";
    public static final String OUTCOME_SKIPPED = "skipped";

    private final MeterRegistry registry;

    public QueryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordQuery(String outcome, Duration duration) {
        timer("qe_query_duration", outcome).record(duration);
    }

    public void recordVectorBackend(String outcome, Duration duration) {
        timer("qe_vector_backend_duration", outcome).record(duration);
    }

    public void recordRerank(String outcome, Duration duration) {
        timer("qe_rerank_duration", outcome).record(duration);
    }

    public void recordCacheRequest(String tier, boolean hit) {
        Counter.builder("qe_cache_requests_total")
            .tag("tier", tier)
            .tag("result", hit ? "hit" : "miss")
            .register(registry)
            .increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    private Timer timer(String name, String outcome) {
        return Timer.builder(name)
            .tag("outcome", outcome)
            .register(registry);
    }
}
