package com.lumen.query.resilience;

public enum FailureKind {
    TRANSIENT,
    PERMANENT,
    CALLER_CANCELLED
}
