package com.lumen.query.api;

public final class QueryTimings {
    private final long totalMs;
    private final long vectorMs;
    private final long keywordMs;
    private final long fusionMs;
    private final long rerankMs;

    public QueryTimings(long totalMs, long vectorMs, long keywordMs, long fusionMs, long rerankMs) {
        this.totalMs = totalMs;
        this.vectorMs = vectorMs;
        this.keywordMs = keywordMs;
        this.fusionMs = fusionMs;
        this.rerankMs = rerankMs;
    }

    public static QueryTimings total(long totalMs) {
        return new QueryTimings(totalMs, 0L, 0L, 0L, 0L);
    }

    public long getTotalMs() {
        return totalMs;
    }

    public long getVectorMs() {
        return vectorMs;
    }

    public long getKeywordMs() {
        return keywordMs;
    }

    public long getFusionMs() {
        return fusionMs;
    }

    public long getRerankMs() {
        return rerankMs;
    }
}
