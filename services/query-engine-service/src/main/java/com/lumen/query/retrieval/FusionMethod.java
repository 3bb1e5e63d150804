package com.lumen.query.retrieval;

import java.util.Locale;

public enum FusionMethod {
    RRF,
    WEIGHTED;

    public static FusionMethod fromString(String value) {
        if (value == null) {
            return RRF;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("w")) {
            return WEIGHTED;
        }
        return RRF;
    }
}
