package com.lumen.query.resilience;

public class GuardedCallException extends RuntimeException {
    public GuardedCallException(Throwable cause) {
        super(cause.getMessage(), cause);
    }
}
