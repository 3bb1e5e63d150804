package com.lumen.query.embed;

public interface EmbeddingProvider {
    float[] embed(String text);
}
