package com.lumen.query.backend;

import com.lumen.query.resilience.TransientFailure;

public class BackendUnavailableException extends RuntimeException implements TransientFailure {
    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
