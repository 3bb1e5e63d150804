package com.lumen.query.embed;

import com.lumen.query.resilience.PermanentFailure;

public class EmbeddingRequestException extends RuntimeException implements PermanentFailure {
    public EmbeddingRequestException(String message) {
        super(message);
    }

    public EmbeddingRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
