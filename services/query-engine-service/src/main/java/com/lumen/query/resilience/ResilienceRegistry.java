package com.lumen.query.resilience;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class ResilienceRegistry {
    public static final String VECTOR_BACKEND = "vector-backend";
    public static final String EMBEDDING_PROVIDER = "embedding-provider";

    private final ResilienceProperties properties;
    private final Map<String, CircuitBreaker> breakers = new LinkedHashMap<>();
    private final RetryExecutor retryExecutor;

    public ResilienceRegistry(ResilienceProperties properties, MeterRegistry meterRegistry, Clock clock) {
        this(properties, meterRegistry, clock, new RetryExecutor(properties.getRetry().toPolicy(), meterRegistry));
    }

    public ResilienceRegistry(
        ResilienceProperties properties,
        MeterRegistry meterRegistry,
        Clock clock,
        RetryExecutor retryExecutor
    ) {
        this.properties = properties;
        this.retryExecutor = retryExecutor;
        FailureClassifier classifier = new FailureClassifier();
        register(VECTOR_BACKEND, properties.getVector(), clock, classifier, meterRegistry);
        register(EMBEDDING_PROVIDER, properties.getEmbedding(), clock, classifier, meterRegistry);
    }

    public CircuitBreaker getVectorBreaker() {
        return breakers.get(VECTOR_BACKEND);
    }

    public CircuitBreaker getEmbeddingBreaker() {
        return breakers.get(EMBEDDING_PROVIDER);
    }

    public RetryExecutor getRetryExecutor() {
        return retryExecutor;
    }

    public List<CircuitBreakerSnapshot> snapshots() {
        return breakers.values().stream()
            .map(CircuitBreaker::snapshot)
            .collect(Collectors.toList());
    }

    public ResilienceProperties getProperties() {
        return properties;
    }

    private void register(
        String name,
        ResilienceProperties.Breaker config,
        Clock clock,
        FailureClassifier classifier,
        MeterRegistry meterRegistry
    ) {
        CircuitBreaker breaker = new CircuitBreaker(
            name,
            config.getFailureThreshold(),
            Duration.ofMillis(config.getFailureWindowMs()),
            Duration.ofMillis(config.getRecoveryTimeoutMs()),
            clock,
            classifier
        );
        breakers.put(name, breaker);
        Gauge.builder("qe_circuit_breaker_state", breaker, b -> b.state().gaugeValue())
            .tag("name", name)
            .description("0=closed, 1=open, 2=half-open")
            .register(meterRegistry);
        FunctionCounter.builder("qe_circuit_breaker_rejected_total", breaker, b -> b.snapshot().getTotalRejected())
            .tag("name", name)
            .register(meterRegistry);
    }
}
