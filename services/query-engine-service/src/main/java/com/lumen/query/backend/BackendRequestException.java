package com.lumen.query.backend;

import com.lumen.query.resilience.PermanentFailure;

public class BackendRequestException extends RuntimeException implements PermanentFailure {
    public BackendRequestException(String message) {
        super(message);
    }

    public BackendRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
