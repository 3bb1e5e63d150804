package com.lumen.query.api;

public enum ServedBy {
    HYBRID,
    VECTOR_ONLY,
    KEYWORD_ONLY,
    CACHE,
    STALE_CACHE
}
