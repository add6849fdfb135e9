package com.example.ContextRetriever.model;

import java.time.Instant;
import java.util.List;

/**
 * One stored interaction. Only ever appended to a {@link SessionHistory}, never edited.
 */
public record SessionRecord(
        Instant timestamp,
        String query,
        Strategy strategyUsed,
        int documentCount,
        String reasoning,
        List<String> keyPoints
) {
    public SessionRecord {
        if (documentCount < 0) {
            throw new IllegalArgumentException("documentCount must be >= 0");
        }
        keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
    }
}
