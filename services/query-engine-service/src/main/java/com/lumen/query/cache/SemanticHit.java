package com.lumen.query.cache;

public final class SemanticHit<V> {
    private final V value;
    private final double similarity;
    private final String matchedQuery;

    public SemanticHit(V value, double similarity, String matchedQuery) {
        this.value = value;
        this.similarity = similarity;
        this.matchedQuery = matchedQuery;
    }

    public V getValue() {
        return value;
    }

    public double getSimilarity() {
        return similarity;
    }

    public String getMatchedQuery() {
        return matchedQuery;
    }
}
