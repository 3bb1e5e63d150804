package com.lumen.query.service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class QueryContext {
    private final String rawQuery;
    private final String normalizedQuery;
    private final List<String> expandedTerms;
    private final boolean useCache;
    private final int rerankTopK;
    private final Double diversityLambda;
    private final int resultLimit;
    private final Map<String, Object> filters;
    private final Instant deadline;

    private QueryContext(Builder builder) {
        this.rawQuery = builder.rawQuery;
        this.normalizedQuery = builder.normalizedQuery;
        this.expandedTerms = builder.expandedTerms == null ? List.of() : List.copyOf(builder.expandedTerms);
        this.useCache = builder.useCache;
        this.rerankTopK = builder.rerankTopK;
        this.diversityLambda = builder.diversityLambda;
        this.resultLimit = builder.resultLimit;
        this.filters = builder.filters == null ? Map.of() : Map.copyOf(builder.filters);
        this.deadline = builder.deadline;
    }

    public static Builder builder() {
        return new Builder();
    }

    public QueryContext withExpandedTerms(List<String> terms) {
        return builder()
            .rawQuery(rawQuery)
            .normalizedQuery(normalizedQuery)
            .expandedTerms(terms)
            .useCache(useCache)
            .rerankTopK(rerankTopK)
            .diversityLambda(diversityLambda)
            .resultLimit(resultLimit)
            .filters(filters)
            .deadline(deadline)
            .build();
    }

    public String getRawQuery() {
        return rawQuery;
    }

    public String getNormalizedQuery() {
        return normalizedQuery;
    }

    public List<String> getExpandedTerms() {
        return expandedTerms;
    }

    public boolean isUseCache() {
        return useCache;
    }

    public int getRerankTopK() {
        return rerankTopK;
    }

    public Double getDiversityLambda() {
        return diversityLambda;
    }

    public int getResultLimit() {
        return resultLimit;
    }

    public Map<String, Object> getFilters() {
        return filters;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public static final class Builder {
        private String rawQuery;
        private String normalizedQuery;
        private List<String> expandedTerms;
        private boolean useCache = true;
        private int rerankTopK;
        private Double diversityLambda;
        private int resultLimit;
        private Map<String, Object> filters;
        private Instant deadline;

        private Builder() {
        }

        public Builder rawQuery(String rawQuery) {
            this.rawQuery = rawQuery;
            return this;
        }

        public Builder normalizedQuery(String normalizedQuery) {
            this.normalizedQuery = normalizedQuery;
            return this;
        }

        public Builder expandedTerms(List<String> expandedTerms) {
            this.expandedTerms = expandedTerms;
            return this;
        }

        public Builder useCache(boolean useCache) {
            this.useCache = useCache;
            return this;
        }

        public Builder rerankTopK(int rerankTopK) {
            this.rerankTopK = rerankTopK;
            return this;
        }

        public Builder diversityLambda(Double diversityLambda) {
            this.diversityLambda = diversityLambda;
            return this;
        }

        public Builder resultLimit(int resultLimit) {
            this.resultLimit = resultLimit;
            return this;
        }

        public Builder filters(Map<String, Object> filters) {
            this.filters = filters;
            return this;
        }

        public Builder deadline(Instant deadline) {
            this.deadline = deadline;
            return this;
        }

        public QueryContext build() {
            return new QueryContext(this);
        }
    }
}
