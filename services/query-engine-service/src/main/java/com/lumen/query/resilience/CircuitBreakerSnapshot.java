package com.lumen.query.resilience;

public final class CircuitBreakerSnapshot {
    private final String name;
    private final CircuitState state;
    private final int failureCount;
    private final long totalRejected;
    private final long totalOpened;
    private final long totalClosed;
    private final long stateChanges;

    public CircuitBreakerSnapshot(
        String name,
        CircuitState state,
        int failureCount,
        long totalRejected,
        long totalOpened,
        long totalClosed,
        long stateChanges
    ) {
        this.name = name;
        this.state = state;
        this.failureCount = failureCount;
        this.totalRejected = totalRejected;
        this.totalOpened = totalOpened;
        this.totalClosed = totalClosed;
        this.stateChanges = stateChanges;
    }

    public String getName() {
        return name;
    }

    public CircuitState getState() {
        return state;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public long getTotalRejected() {
        return totalRejected;
    }

    public long getTotalOpened() {
        return totalOpened;
    }

    public long getTotalClosed() {
        return totalClosed;
    }

    public long getStateChanges() {
        return stateChanges;
    }
}
