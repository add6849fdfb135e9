package com.example.ContextRetriever.service;

import com.example.ContextRetriever.config.RetrieverProperties;
import com.example.ContextRetriever.model.SessionHistory;
import com.example.ContextRetriever.model.SessionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local session history for running without Redis.
 * Per-user atomicity comes from {@link ConcurrentMap#compute}; expiry is checked on access.
 */
public class InMemorySessionMemory implements SessionMemory {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionMemory.class);

    private final ConcurrentMap<String, Entry> sessions = new ConcurrentHashMap<>();
    private final int maxMessages;
    private final Duration ttl;
    private final Clock clock;

    public InMemorySessionMemory(RetrieverProperties properties, Clock clock) {
        this.maxMessages = properties.maxSessionMessages();
        this.ttl = properties.sessionTtl();
        this.clock = clock;
    }

    @Override
    public SessionHistory getHistory(String userId) {
        String key = SessionMemory.keyFor(userId);
        Entry entry = sessions.get(key);
        if (entry == null) {
            return SessionHistory.empty();
        }
        if (entry.isExpired(clock.instant())) {
            sessions.remove(key, entry);
            log.debug("Session history for user={} expired", userId);
            return SessionHistory.empty();
        }
        return new SessionHistory(entry.records());
    }

    @Override
    public void append(String userId, SessionRecord record) {
        Instant now = clock.instant();
        sessions.compute(SessionMemory.keyFor(userId), (key, current) -> {
            List<SessionRecord> records = new ArrayList<>();
            if (current != null && !current.isExpired(now)) {
                records.addAll(current.records());
            }
            records.add(record);
            int overflow = records.size() - maxMessages;
            if (overflow > 0) {
                records.subList(0, overflow).clear();
            }
            return new Entry(List.copyOf(records), now.plus(ttl));
        });
    }

    @Override
    public void clear(String userId) {
        sessions.remove(SessionMemory.keyFor(userId));
    }

    private record Entry(List<SessionRecord> records, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
