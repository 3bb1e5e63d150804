package com.lumen.query.embed;

public enum EmbeddingMode {
    HTTP,
    HASHING
}
