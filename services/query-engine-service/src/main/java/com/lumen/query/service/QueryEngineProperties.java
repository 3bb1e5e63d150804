package com.lumen.query.service;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "query.engine")
public class QueryEngineProperties {
    private int defaultLimit = 10;
    private int maxResultLimit = 100;
    private int maxQueryLength = 1000;
    private int vectorTopK = 50;
    private int keywordTopK = 50;
    private int rrfK = 60;
    private long requestTimeoutMs = 5000;
    private long embeddingTimeoutMs = 500;
    private String fusionMethod = "rrf";
    private double weightedAlpha = 0.7;
    private Double nearDuplicateThreshold;
    private int poolSize = 8;

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxResultLimit() {
        return maxResultLimit;
    }

    public void setMaxResultLimit(int maxResultLimit) {
        this.maxResultLimit = maxResultLimit;
    }

    public int getMaxQueryLength() {
        return maxQueryLength;
    }

    public void setMaxQueryLength(int maxQueryLength) {
        this.maxQueryLength = maxQueryLength;
    }

    public int getVectorTopK() {
        return vectorTopK;
    }

    public void setVectorTopK(int vectorTopK) {
        this.vectorTopK = vectorTopK;
    }

    public int getKeywordTopK() {
        return keywordTopK;
    }

    public void setKeywordTopK(int keywordTopK) {
        this.keywordTopK = keywordTopK;
    }

    public int getRrfK() {
        return rrfK;
    }

    public void setRrfK(int rrfK) {
        this.rrfK = rrfK;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public String getFusionMethod() {
        return fusionMethod;
    }

    public void setFusionMethod(String fusionMethod) {
        this.fusionMethod = fusionMethod;
    }

    public double getWeightedAlpha() {
        return weightedAlpha;
    }

    public void setWeightedAlpha(double weightedAlpha) {
        this.weightedAlpha = weightedAlpha;
    }

    public Double getNearDuplicateThreshold() {
        return nearDuplicateThreshold;
    }

    public void setNearDuplicateThreshold(Double nearDuplicateThreshold) {
        this.nearDuplicateThreshold = nearDuplicateThreshold;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public long getEmbeddingTimeoutMs() {
        return embeddingTimeoutMs;
    }

    public void setEmbeddingTimeoutMs(long embeddingTimeoutMs) {
        this.embeddingTimeoutMs = embeddingTimeoutMs;
    }
}
