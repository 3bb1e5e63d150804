package com.lumen.query.expansion;

import com.lumen.query.text.Tokenizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class QueryExpander {
    private static final Logger log = LoggerFactory.getLogger(QueryExpander.class);

    private final SynonymSource synonymSource;
    private final QueryExpansionProperties properties;
    private volatile Map<String, String> acronyms;

    public QueryExpander(SynonymSource synonymSource, QueryExpansionProperties properties) {
        this.synonymSource = synonymSource;
        this.properties = properties;
        Map<String, String> initial = new LinkedHashMap<>(synonymSource.acronyms());
        if (properties.getCustomAcronyms() != null) {
            properties.getCustomAcronyms().forEach((acronym, expansion) ->
                initial.put(acronym.toLowerCase(Locale.ROOT), expansion));
        }
        this.acronyms = Map.copyOf(initial);
    }

    public List<String> expand(String query) {
        return expandDetailed(query).getExpandedTerms();
    }

    public ExpansionResult expandDetailed(String query) {
        List<String> originals = originalTerms(query);
        if (!properties.isEnabled() || originals.isEmpty()) {
            return new ExpansionResult(query, originals, originals, Map.of(), Map.of());
        }

        int budget = (int) Math.floor(originals.size() * Math.max(1.0, properties.getMaxExpansionFactor()));
        int perTermCap = Math.max(0, properties.getMaxExpansionsPerTerm());
        LinkedHashSet<String> expanded = new LinkedHashSet<>(originals);
        Map<String, String> acronymExpansions = new LinkedHashMap<>();
        Map<String, List<String>> synonymExpansions = new LinkedHashMap<>();
        Map<String, String> acronymTable = acronyms;

        for (String term : originals) {
            int addedForTerm = 0;
            if (properties.isUseAcronyms()) {
                String phrase = acronymTable.get(term);
                if (phrase != null) {
                    acronymExpansions.put(term, phrase);
                    for (String word : Tokenizer.contentWords(phrase)) {
                        if (addedForTerm >= perTermCap || expanded.size() >= budget) {
                            break;
                        }
                        if (expanded.add(word)) {
                            addedForTerm++;
                        }
                    }
                }
            }
            if (properties.isUseSynonyms()) {
                List<String> synonyms = new ArrayList<>();
                for (RelatedTerm candidate : rankedSynonyms(term)) {
                    if (addedForTerm >= perTermCap || expanded.size() >= budget) {
                        break;
                    }
                    if (expanded.add(candidate.getTerm())) {
                        synonyms.add(candidate.getTerm());
                        addedForTerm++;
                    }
                }
                if (!synonyms.isEmpty()) {
                    synonymExpansions.put(term, synonyms);
                }
            }
        }

        List<String> terms = new ArrayList<>(expanded);
        log.debug("query_expanded original={} expanded={}", originals, terms);
        return new ExpansionResult(query, originals, terms, synonymExpansions, acronymExpansions);
    }

    public String toOrQuery(String query) {
        return String.join(" OR ", expand(query));
    }

    public void addAcronym(String acronym, String expansion) {
        if (acronym == null || acronym.isBlank() || expansion == null || expansion.isBlank()) {
            throw new IllegalArgumentException("acronym and expansion must be non-blank");
        }
        synchronized (this) {
            Map<String, String> next = new LinkedHashMap<>(acronyms);
            next.put(acronym.trim().toLowerCase(Locale.ROOT), expansion.trim());
            acronyms = Map.copyOf(next);
        }
    }

    public boolean removeAcronym(String acronym) {
        if (acronym == null) {
            return false;
        }
        String key = acronym.trim().toLowerCase(Locale.ROOT);
        synchronized (this) {
            if (!acronyms.containsKey(key)) {
                return false;
            }
            Map<String, String> next = new LinkedHashMap<>(acronyms);
            next.remove(key);
            acronyms = Map.copyOf(next);
            return true;
        }
    }

    public Map<String, String> getAcronyms() {
        return acronyms;
    }

    private List<String> originalTerms(String query) {
        List<String> words = Tokenizer.contentWords(query);
        if (words.isEmpty()) {
            // all stopwords: searching on them beats searching on nothing
            words = Tokenizer.tokenize(query);
        }
        return new ArrayList<>(new LinkedHashSet<>(words));
    }

    private List<RelatedTerm> rankedSynonyms(String term) {
        Set<PartOfSpeech> sourcePos = synonymSource.partsOfSpeech(term);
        List<RelatedTerm> candidates = new ArrayList<>();
        for (RelatedTerm candidate : synonymSource.related(term)) {
            if (candidate.getTerm().equals(term) || candidate.getTerm().contains(" ")) {
                continue;
            }
            if (candidate.getFrequency() < properties.getMinFrequency()) {
                continue;
            }
            if (!sourcePos.isEmpty() && candidate.getPartOfSpeech() != null
                && !sourcePos.contains(candidate.getPartOfSpeech())) {
                continue;
            }
            candidates.add(candidate);
        }
        candidates.sort(Comparator.comparingDouble(RelatedTerm::getFrequency).reversed()
            .thenComparing(RelatedTerm::getTerm));
        return candidates;
    }
}
