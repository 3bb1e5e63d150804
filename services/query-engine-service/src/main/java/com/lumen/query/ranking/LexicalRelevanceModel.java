package com.lumen.query.ranking;

import com.lumen.query.text.Tokenizer;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class LexicalRelevanceModel implements PairwiseRelevanceModel {
    private static final double K1 = 1.2;
    private static final double PHRASE_WEIGHT = 0.2;

    @Override
    public double[] score(String query, List<String> passages) {
        List<String> queryTerms = Tokenizer.contentWords(query);
        Set<String> uniqueTerms = new LinkedHashSet<>(queryTerms);
        double[] scores = new double[passages.size()];
        for (int i = 0; i < passages.size(); i++) {
            scores[i] = scorePassage(queryTerms, uniqueTerms, passages.get(i));
        }
        return scores;
    }

    private double scorePassage(List<String> queryTerms, Set<String> uniqueTerms, String passage) {
        if (uniqueTerms.isEmpty() || passage == null || passage.isBlank()) {
            return 0.0;
        }
        Map<String, Integer> frequencies = Tokenizer.termFrequencies(passage);
        double termScore = 0.0;
        for (String term : uniqueTerms) {
            int tf = frequencies.getOrDefault(term, 0);
            termScore += tf / (tf + K1);
        }
        termScore /= uniqueTerms.size();

        double phraseScore = 0.0;
        if (queryTerms.size() > 1) {
            String text = " " + String.join(" ", Tokenizer.contentWords(passage)) + " ";
            int pairs = 0;
            int matched = 0;
            for (int i = 0; i + 1 < queryTerms.size(); i++) {
                pairs++;
                if (text.contains(" " + queryTerms.get(i) + " " + queryTerms.get(i + 1) + " ")) {
                    matched++;
                }
            }
            phraseScore = (double) matched / pairs;
        }
        return Math.min(1.0, (1.0 - PHRASE_WEIGHT) * termScore + PHRASE_WEIGHT * phraseScore);
    }
}
