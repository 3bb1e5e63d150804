package com.lumen.query.service;

import com.lumen.query.retrieval.SearchCandidate;
import java.util.List;

public final class CachedResult {
    private final String query;
    private final String params;
    private final List<String> terms;
    private final List<SearchCandidate> results;

    public CachedResult(String query, String params, List<String> terms, List<SearchCandidate> results) {
        this.query = query;
        this.params = params;
        this.terms = List.copyOf(terms);
        this.results = List.copyOf(results);
    }

    public String getQuery() {
        return query;
    }

    // fingerprint of the result-shaping parameters (limit, rerank depth, lambda, filters, fusion)
    public String getParams() {
        return params;
    }

    public List<String> getTerms() {
        return terms;
    }

    public List<SearchCandidate> getResults() {
        return results;
    }
}
