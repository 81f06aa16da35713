package com.dealflow.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Investment recommendation, ordered from most to least favourable.
 * Serialised in lower case ("strong_invest") as the reasoning service writes it.
 */
public enum Recommendation {
    STRONG_INVEST,
    INVEST,
    CONDITIONAL_INVEST,
    MORE_DILIGENCE,
    PASS,
    STRONG_PASS;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse: case, surrounding whitespace and '-' vs '_' are ignored.
     * Returns {@code fallback} for null or unknown text.
     */
    public static Recommendation fromValue(String text, Recommendation fallback) {
        if (text == null || text.isBlank()) {
            return fallback;
        }
        String key = text.trim().replace('-', '_').replace(' ', '_').toUpperCase(Locale.ROOT);
        for (Recommendation r : values()) {
            if (r.name().equals(key)) {
                return r;
            }
        }
        return fallback;
    }

    @JsonCreator
    static Recommendation fromJson(String text) {
        return fromValue(text, MORE_DILIGENCE);
    }
}
