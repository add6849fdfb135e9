package com.example.ContextRetriever.service;

import com.example.ContextRetriever.config.RetrieverProperties;
import com.example.ContextRetriever.model.SessionHistory;
import com.example.ContextRetriever.model.SessionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.util.ArrayList;
import java.util.List;

/**
 * Session history kept in a Redis list per user ({@code session:<userId>}).
 *
 * <p>Each element is one JSON-serialized {@link SessionRecord}; the list is ordered oldest to
 * newest. Redis expires the key itself, so an idle history simply reads back as absent.
 */
public class RedisSessionMemory implements SessionMemory {

    private static final Logger log = LoggerFactory.getLogger(RedisSessionMemory.class);

    /**
     * Push, trim to the newest ARGV[2] entries and refresh the TTL in one server-side step,
     * so concurrent appends for the same user cannot lose evictions or overshoot the cap.
     */
    static final RedisScript<Long> APPEND_SCRIPT = new DefaultRedisScript<>(
            """
            redis.call('RPUSH', KEYS[1], ARGV[1])
            redis.call('LTRIM', KEYS[1], -tonumber(ARGV[2]), -1)
            redis.call('PEXPIRE', KEYS[1], ARGV[3])
            return redis.call('LLEN', KEYS[1])
            """,
            Long.class
    );

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final int maxMessages;
    private final long ttlMillis;

    public RedisSessionMemory(StringRedisTemplate redisTemplate,
                              ObjectMapper objectMapper,
                              RetrieverProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.maxMessages = properties.maxSessionMessages();
        this.ttlMillis = properties.sessionTtl().toMillis();
    }

    /**
     * Load at most the newest {@code maxMessages} records.
     */
    @Override
    public SessionHistory getHistory(String userId) {
        String key = SessionMemory.keyFor(userId);
        List<String> rawRecords;
        try {
            rawRecords = redisTemplate.opsForList().range(key, -maxMessages, -1);
        } catch (DataAccessException e) {
            log.warn("Session memory unavailable, continuing without history for user={}: {}",
                    userId, e.getMessage());
            return SessionHistory.empty();
        }
        if (rawRecords == null || rawRecords.isEmpty()) {
            return SessionHistory.empty();
        }

        List<SessionRecord> records = new ArrayList<>(rawRecords.size());
        for (String raw : rawRecords) {
            try {
                records.add(objectMapper.readValue(raw, SessionRecord.class));
            } catch (JsonProcessingException e) {
                // Skip malformed entries instead of failing the whole load
                log.debug("Skipping malformed session record for user={}: {}", userId, e.getOriginalMessage());
            }
        }
        return new SessionHistory(records);
    }

    @Override
    public void append(String userId, SessionRecord record) {
        String key = SessionMemory.keyFor(userId);
        String payload;
        try {
            payload = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize session record for user={}, skipping write", userId, e);
            return;
        }

        try {
            Long size = redisTemplate.execute(
                    APPEND_SCRIPT,
                    List.of(key),
                    payload,
                    String.valueOf(maxMessages),
                    String.valueOf(ttlMillis)
            );
            log.debug("Session history for user={} now holds {} record(s)", userId, size);
        } catch (DataAccessException e) {
            log.warn("Session memory unavailable, dropping record for user={}: {}", userId, e.getMessage());
        }
    }

    @Override
    public void clear(String userId) {
        try {
            redisTemplate.delete(SessionMemory.keyFor(userId));
        } catch (DataAccessException e) {
            log.warn("Session memory unavailable, could not clear history for user={}: {}",
                    userId, e.getMessage());
        }
    }
}
