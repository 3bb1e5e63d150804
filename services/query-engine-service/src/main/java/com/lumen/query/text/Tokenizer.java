package com.lumen.query.text;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

public final class Tokenizer {
    private static final Pattern SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Set<String> STOPWORDS = Set.of(
        "a", "an", "and", "are", "as", "at", "be", "by", "do", "does", "for", "from", "how",
        "in", "is", "it", "its", "of", "on", "or", "that", "the", "this", "to", "was", "what",
        "when", "where", "which", "who", "why", "with"
    );

    private Tokenizer() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] parts = SPLIT.split(text.toLowerCase(Locale.ROOT));
        List<String> tokens = new ArrayList<>(parts.length);
        for (String part : parts) {
            if (!part.isEmpty()) {
                tokens.add(part);
            }
        }
        return tokens;
    }

    public static List<String> contentWords(String text) {
        List<String> words = new ArrayList<>();
        for (String token : tokenize(text)) {
            if (!isStopword(token)) {
                words.add(token);
            }
        }
        return words;
    }

    public static boolean isStopword(String token) {
        return STOPWORDS.contains(token);
    }

    public static Map<String, Integer> termFrequencies(String text) {
        Map<String, Integer> frequencies = new HashMap<>();
        for (String token : contentWords(text)) {
            frequencies.merge(token, 1, Integer::sum);
        }
        return frequencies;
    }

    public static double cosine(Map<String, Integer> left, Map<String, Integer> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        Map<String, Integer> smaller = left.size() <= right.size() ? left : right;
        Map<String, Integer> larger = smaller == left ? right : left;
        double dot = 0.0;
        for (Map.Entry<String, Integer> entry : smaller.entrySet()) {
            Integer other = larger.get(entry.getKey());
            if (other != null) {
                dot += (double) entry.getValue() * other;
            }
        }
        if (dot == 0.0) {
            return 0.0;
        }
        return dot / (norm(left) * norm(right));
    }

    private static double norm(Map<String, Integer> vector) {
        double sum = 0.0;
        for (int value : vector.values()) {
            sum += (double) value * value;
        }
        return Math.sqrt(sum);
    }
}
