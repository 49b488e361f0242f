package com.customer.matching.core.model;

import java.util.Locale;

/**
 * Coarse confidence band attached to a similarity score.
 */
public enum Confidence {
    VERY_LOW,
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Maps a similarity in [0, 1] to its confidence band.
     */
    public static Confidence forSimilarity(double similarity) {
        if (similarity >= 0.6) {
            return HIGH;
        } else if (similarity >= 0.4) {
            return MEDIUM;
        } else if (similarity >= 0.2) {
            return LOW;
        }
        return VERY_LOW;
    }

    /**
     * Parses the wire name ({@code "very_low"}, {@code "high"}, ...).
     *
     * @return the matching band, or null for null or unrecognized input
     */
    public static Confidence fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
