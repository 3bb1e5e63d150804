package com.lumen.query.resilience;

import java.time.Duration;

public final class RetryPolicy {
    private final int maxAttempts;
    private final Duration initialWait;
    private final Duration maxWait;
    private final double multiplier;
    private final double jitter;

    public RetryPolicy(int maxAttempts, Duration initialWait, Duration maxWait, double multiplier, double jitter) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (jitter < 0.0 || jitter >= 1.0) {
            throw new IllegalArgumentException("jitter must be within [0, 1)");
        }
        this.maxAttempts = maxAttempts;
        this.initialWait = initialWait;
        this.maxWait = maxWait;
        this.multiplier = multiplier;
        this.jitter = jitter;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0, 0.2);
    }

    public Duration backoff(int failedAttempt, double uniform) {
        double jitterFactor = 1.0 - jitter + (2.0 * jitter * uniform);
        double waitMs = initialWait.toMillis() * Math.pow(multiplier, failedAttempt - 1) * jitterFactor;
        long capped = (long) Math.min(waitMs, (double) maxWait.toMillis());
        return Duration.ofMillis(Math.max(0L, capped));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialWait() {
        return initialWait;
    }

    public Duration getMaxWait() {
        return maxWait;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public double getJitter() {
        return jitter;
    }
}
