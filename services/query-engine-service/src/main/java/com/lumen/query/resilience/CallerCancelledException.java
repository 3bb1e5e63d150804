package com.lumen.query.resilience;

public class CallerCancelledException extends RuntimeException {
    public CallerCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
