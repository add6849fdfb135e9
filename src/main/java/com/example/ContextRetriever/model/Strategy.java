package com.example.ContextRetriever.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Retrieval path chosen for a query.
 */
public enum Strategy {
    LOCAL("local"),
    WEB("web"),
    BOTH("both");

    private final String wireName;

    Strategy(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used by the reasoning service ("local", "web", "both").
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Resolve a strategy from the reasoning service's vocabulary.
     * Unknown or blank values resolve to empty.
     */
    public static Optional<Strategy> fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Strategy strategy : values()) {
            if (strategy.wireName.equals(normalized)) {
                return Optional.of(strategy);
            }
        }
        return Optional.empty();
    }
}
