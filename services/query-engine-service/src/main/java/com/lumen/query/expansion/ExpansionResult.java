package com.lumen.query.expansion;

import java.util.List;
import java.util.Map;

public final class ExpansionResult {
    private final String originalQuery;
    private final List<String> originalTerms;
    private final List<String> expandedTerms;
    private final Map<String, List<String>> synonymExpansions;
    private final Map<String, String> acronymExpansions;

    public ExpansionResult(
        String originalQuery,
        List<String> originalTerms,
        List<String> expandedTerms,
        Map<String, List<String>> synonymExpansions,
        Map<String, String> acronymExpansions
    ) {
        this.originalQuery = originalQuery;
        this.originalTerms = List.copyOf(originalTerms);
        this.expandedTerms = List.copyOf(expandedTerms);
        this.synonymExpansions = Map.copyOf(synonymExpansions);
        this.acronymExpansions = Map.copyOf(acronymExpansions);
    }

    public String getOriginalQuery() {
        return originalQuery;
    }

    public List<String> getOriginalTerms() {
        return originalTerms;
    }

    public List<String> getExpandedTerms() {
        return expandedTerms;
    }

    public Map<String, List<String>> getSynonymExpansions() {
        return synonymExpansions;
    }

    public Map<String, String> getAcronymExpansions() {
        return acronymExpansions;
    }

    public int getTotalExpansions() {
        return expandedTerms.size() - originalTerms.size();
    }
}
