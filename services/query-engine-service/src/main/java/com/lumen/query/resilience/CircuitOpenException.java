package com.lumen.query.resilience;

public class CircuitOpenException extends RuntimeException {
    private final String breakerName;

    public CircuitOpenException(String breakerName) {
        super("Circuit breaker '" + breakerName + "' is OPEN");
        this.breakerName = breakerName;
    }

    public String getBreakerName() {
        return breakerName;
    }
}
