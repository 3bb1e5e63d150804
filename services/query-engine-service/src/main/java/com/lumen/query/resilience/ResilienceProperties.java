package com.lumen.query.resilience;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "query.resilience")
public class ResilienceProperties {
    private Breaker vector = new Breaker();
    private Breaker embedding = new Breaker();
    private Retry retry = new Retry();

    public Breaker getVector() {
        return vector;
    }

    public void setVector(Breaker vector) {
        this.vector = vector;
    }

    public Breaker getEmbedding() {
        return embedding;
    }

    public void setEmbedding(Breaker embedding) {
        this.embedding = embedding;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public static class Breaker {
        private int failureThreshold = 5;
        private long failureWindowMs = 60000;
        private long recoveryTimeoutMs = 30000;

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public long getFailureWindowMs() {
            return failureWindowMs;
        }

        public void setFailureWindowMs(long failureWindowMs) {
            this.failureWindowMs = failureWindowMs;
        }

        public long getRecoveryTimeoutMs() {
            return recoveryTimeoutMs;
        }

        public void setRecoveryTimeoutMs(long recoveryTimeoutMs) {
            this.recoveryTimeoutMs = recoveryTimeoutMs;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private long initialWaitMs = 1000;
        private long maxWaitMs = 10000;
        private double multiplier = 2.0;
        private double jitter = 0.2;

        public RetryPolicy toPolicy() {
            return new RetryPolicy(
                maxAttempts,
                Duration.ofMillis(initialWaitMs),
                Duration.ofMillis(maxWaitMs),
                multiplier,
                jitter
            );
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialWaitMs() {
            return initialWaitMs;
        }

        public void setInitialWaitMs(long initialWaitMs) {
            this.initialWaitMs = initialWaitMs;
        }

        public long getMaxWaitMs() {
            return maxWaitMs;
        }

        public void setMaxWaitMs(long maxWaitMs) {
            this.maxWaitMs = maxWaitMs;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }
}
