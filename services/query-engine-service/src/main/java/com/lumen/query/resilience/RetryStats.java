package com.lumen.query.resilience;

public final class RetryStats {
    private final long totalAttempts;
    private final long totalRetries;
    private final long totalSuccesses;
    private final long totalFailures;

    public RetryStats(long totalAttempts, long totalRetries, long totalSuccesses, long totalFailures) {
        this.totalAttempts = totalAttempts;
        this.totalRetries = totalRetries;
        this.totalSuccesses = totalSuccesses;
        this.totalFailures = totalFailures;
    }

    public long getTotalAttempts() {
        return totalAttempts;
    }

    public long getTotalRetries() {
        return totalRetries;
    }

    public long getTotalSuccesses() {
        return totalSuccesses;
    }

    public long getTotalFailures() {
        return totalFailures;
    }
}
