package com.lumen.query.api;

import com.lumen.query.retrieval.SearchCandidate;
import java.util.List;

public final class QueryResponse {
    private final List<SearchCandidate> results;
    private final boolean degradedMode;
    private final ServedBy servedBy;
    private final List<String> expandedTerms;
    private final QueryTimings timings;
    private final List<String> warnings;

    public QueryResponse(
        List<SearchCandidate> results,
        boolean degradedMode,
        ServedBy servedBy,
        List<String> expandedTerms,
        QueryTimings timings,
        List<String> warnings
    ) {
        this.results = List.copyOf(results);
        this.degradedMode = degradedMode;
        this.servedBy = servedBy;
        this.expandedTerms = expandedTerms == null ? List.of() : List.copyOf(expandedTerms);
        this.timings = timings;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public List<SearchCandidate> getResults() {
        return results;
    }

    public boolean isDegradedMode() {
        return degradedMode;
    }

    public ServedBy getServedBy() {
        return servedBy;
    }

    public List<String> getExpandedTerms() {
        return expandedTerms;
    }

    public QueryTimings getTimings() {
        return timings;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
