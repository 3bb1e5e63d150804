package com.lumen.query.api;

import com.lumen.query.resilience.PermanentFailure;

public class InvalidQueryException extends IllegalArgumentException implements PermanentFailure {
    public InvalidQueryException(String message) {
        super(message);
    }
}
