package com.lumen.query.ranking;

import com.lumen.query.resilience.TransientFailure;

public class RankingUnavailableException extends RuntimeException implements TransientFailure {
    public RankingUnavailableException(String message) {
        super(message);
    }

    public RankingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
