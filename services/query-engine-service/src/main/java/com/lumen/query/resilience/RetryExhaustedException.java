package com.lumen.query.resilience;

public class RetryExhaustedException extends RuntimeException {
    private final String operation;
    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastError) {
        super(operation + " failed after " + attempts + " attempts: "
            + (lastError == null ? "unknown" : lastError.getMessage()), lastError);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }
}
