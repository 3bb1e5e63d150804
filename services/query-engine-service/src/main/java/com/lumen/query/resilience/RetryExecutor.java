package com.lumen.query.resilience;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy defaultPolicy;
    private final FailureClassifier classifier;
    private final Sleeper sleeper;
    private final DoubleSupplier uniform;
    private final MeterRegistry meterRegistry;
    private final LongAdder attempts = new LongAdder();
    private final LongAdder retries = new LongAdder();
    private final LongAdder successes = new LongAdder();
    private final LongAdder failures = new LongAdder();

    public RetryExecutor(RetryPolicy defaultPolicy, MeterRegistry meterRegistry) {
        this(defaultPolicy, new FailureClassifier(), Sleeper.THREAD,
            () -> ThreadLocalRandom.current().nextDouble(), meterRegistry);
    }

    public RetryExecutor(
        RetryPolicy defaultPolicy,
        FailureClassifier classifier,
        Sleeper sleeper,
        DoubleSupplier uniform,
        MeterRegistry meterRegistry
    ) {
        this.defaultPolicy = defaultPolicy;
        this.classifier = classifier;
        this.sleeper = sleeper;
        this.uniform = uniform;
        this.meterRegistry = meterRegistry;
    }

    public <T> T execute(String operation, Callable<T> fn) {
        return execute(operation, fn, defaultPolicy);
    }

    public <T> T execute(String operation, Callable<T> fn, RetryPolicy policy) {
        Exception lastError = null;
        int maxAttempts = policy.getMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            attempts.increment();
            try {
                T result = fn.call();
                successes.increment();
                return result;
            } catch (CircuitOpenException e) {
                failures.increment();
                throw e;
            } catch (Exception e) {
                FailureKind kind = classifier.classify(e);
                if (kind != FailureKind.TRANSIENT) {
                    failures.increment();
                    throw FailureClassifier.propagate(e);
                }
                lastError = e;
                if (attempt == maxAttempts) {
                    break;
                }
                Duration wait = policy.backoff(attempt, uniform.getAsDouble());
                retries.increment();
                retryCounter(operation).increment();
                log.warn("retry_scheduled operation={} attempt={} max_attempts={} wait_ms={} error={}",
                    operation, attempt, maxAttempts, wait.toMillis(), e.toString());
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    failures.increment();
                    throw new CallerCancelledException(operation + " interrupted during retry backoff", e);
                }
            }
        }
        failures.increment();
        throw new RetryExhaustedException(operation, maxAttempts, lastError);
    }

    public RetryStats stats() {
        return new RetryStats(attempts.sum(), retries.sum(), successes.sum(), failures.sum());
    }

    public RetryPolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    private Counter retryCounter(String operation) {
        return Counter.builder("qe_retries_total")
            .tag("operation", operation)
            .register(meterRegistry);
    }
}
