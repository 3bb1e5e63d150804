package com.lumen.query.expansion;

import java.util.Locale;

public enum PartOfSpeech {
    NOUN,
    VERB,
    ADJECTIVE,
    ADVERB;

    public static PartOfSpeech from(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "n":
            case "noun":
                return NOUN;
            case "v":
            case "verb":
                return VERB;
            case "a":
            case "adj":
            case "adjective":
                return ADJECTIVE;
            case "r":
            case "adv":
            case "adverb":
                return ADVERB;
            default:
                return null;
        }
    }
}
