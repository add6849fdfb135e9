package com.example.ContextRetriever.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-user interaction history, ordered oldest to newest.
 */
public record SessionHistory(List<SessionRecord> records) {

    private static final SessionHistory EMPTY = new SessionHistory(List.of());

    public SessionHistory {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static SessionHistory empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }

    /**
     * Newest record first, limited to {@code limit} entries.
     */
    public List<SessionRecord> mostRecentFirst(int limit) {
        List<SessionRecord> reversed = new ArrayList<>(records);
        Collections.reverse(reversed);
        return reversed.subList(0, Math.min(Math.max(limit, 0), reversed.size()));
    }
}
