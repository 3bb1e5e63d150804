package com.lumen.query.embed;

import com.lumen.query.text.Tokenizer;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

public class HashingEmbedder implements EmbeddingProvider {
    public static final int DEFAULT_DIMENSION = 384;

    private final int dimension;

    public HashingEmbedder() {
        this(DEFAULT_DIMENSION);
    }

    public HashingEmbedder(int dimension) {
        if (dimension < 8) {
            throw new IllegalArgumentException("dimension must be >= 8");
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingRequestException("embed_empty_text");
        }
        List<String> tokens = Tokenizer.tokenize(text);
        float[] vector = new float[dimension];
        for (int i = 0; i < tokens.size(); i++) {
            accumulate(vector, tokens.get(i), 1.0f);
            if (i + 1 < tokens.size()) {
                accumulate(vector, tokens.get(i) + " " + tokens.get(i + 1), 0.5f);
            }
        }
        return VectorMath.normalize(vector);
    }

    public int getDimension() {
        return dimension;
    }

    private void accumulate(float[] vector, String feature, float weight) {
        long hash = stableHash(feature);
        int bucket = (int) Math.floorMod(hash, (long) dimension);
        float sign = ((hash >>> 63) == 0L) ? 1.0f : -1.0f;
        vector[bucket] += sign * weight;
    }

    private long stableHash(String feature) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(feature.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(hash, 0, 8).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
