package com.example.ContextRetriever.service;

import com.example.ContextRetriever.model.SessionHistory;
import com.example.ContextRetriever.model.SessionRecord;

/**
 * Bounded, expiring per-user interaction history.
 *
 * <p>Implementations never throw on backend trouble: reads degrade to an empty history and
 * writes degrade to a no-op, both logged. Expiry is lazy; nothing sweeps in the background.
 */
public interface SessionMemory {

    String KEY_PREFIX = "session:";

    /**
     * History for {@code userId}, oldest first. Empty when absent, expired or unreachable.
     */
    SessionHistory getHistory(String userId);

    /**
     * Append at the tail, evict oldest records beyond the size cap and restart the TTL window.
     * Atomic per user.
     */
    void append(String userId, SessionRecord record);

    /**
     * Drop all history for {@code userId}. Idempotent.
     */
    void clear(String userId);

    static String keyFor(String userId) {
        return KEY_PREFIX + userId;
    }
}
