package com.lumen.query.embed;

import com.lumen.query.resilience.TransientFailure;

public class EmbeddingUnavailableException extends RuntimeException implements TransientFailure {
    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
