package com.lumen.query.api;

import java.util.LinkedHashMap;
import java.util.Map;

public class QueryRequest {
    private String query;
    private Integer limit;
    private Integer rerankTopK;
    private Double diversityLambda;
    private boolean useCache = true;
    private Map<String, Object> filters = new LinkedHashMap<>();

    public static QueryRequest of(String query) {
        QueryRequest request = new QueryRequest();
        request.setQuery(query);
        return request;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public Integer getRerankTopK() {
        return rerankTopK;
    }

    public void setRerankTopK(Integer rerankTopK) {
        this.rerankTopK = rerankTopK;
    }

    public Double getDiversityLambda() {
        return diversityLambda;
    }

    public void setDiversityLambda(Double diversityLambda) {
        this.diversityLambda = diversityLambda;
    }

    public boolean isUseCache() {
        return useCache;
    }

    public void setUseCache(boolean useCache) {
        this.useCache = useCache;
    }

    public Map<String, Object> getFilters() {
        return filters;
    }

    public void setFilters(Map<String, Object> filters) {
        this.filters = filters;
    }
}
