package com.lumen.query.resilience;

// dependency outages (connection refused, 5xx, timeouts) that may succeed on a later attempt
public interface TransientFailure {
}
