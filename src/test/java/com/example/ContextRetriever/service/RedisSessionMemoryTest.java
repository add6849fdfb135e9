package com.example.ContextRetriever.service;

import com.example.ContextRetriever.RetrieverPropertiesFixture;
import com.example.ContextRetriever.model.SessionHistory;
import com.example.ContextRetriever.model.SessionRecord;
import com.example.ContextRetriever.model.Strategy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RedisSessionMemoryTest {

    private static final String KEY = "session:alice";

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ListOperations<String, String> listOps;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private RedisSessionMemory memory;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForList()).thenReturn(listOps);
        memory = new RedisSessionMemory(
                redisTemplate,
                objectMapper,
                RetrieverPropertiesFixture.session(Duration.ofMinutes(30), 10)
        );
    }

    @Test
    @DisplayName("Append pushes, trims and refreshes the TTL in a single script call")
    void appendRunsAtomicScript() {
        SessionRecord record = record("what is rag?");

        memory.append("alice", record);

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(redisTemplate).execute(
                eq(RedisSessionMemory.APPEND_SCRIPT),
                eq(List.of(KEY)),
                payload.capture(),
                eq("10"),
                eq(String.valueOf(Duration.ofMinutes(30).toMillis()))
        );
        assertThat((String) payload.getValue()).contains("what is rag?");
    }

    @Test
    @DisplayName("A record written by append reads back with equal fields")
    void roundTripPreservesRecord() {
        SessionRecord record = record("round trip");
        memory.append("alice", record);

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(redisTemplate).execute(eq(RedisSessionMemory.APPEND_SCRIPT), eq(List.of(KEY)),
                payload.capture(), anyString(), anyString());
        when(listOps.range(KEY, -10, -1)).thenReturn(List.of((String) payload.getValue()));

        SessionHistory history = memory.getHistory("alice");

        assertThat(history.records()).containsExactly(record);
    }

    @Test
    @DisplayName("Malformed entries are skipped on read")
    void skipsMalformedEntries() throws Exception {
        SessionRecord good = record("good");
        when(listOps.range(KEY, -10, -1)).thenReturn(List.of("{not json", objectMapper.writeValueAsString(good)));

        assertThat(memory.getHistory("alice").records()).containsExactly(good);
    }

    @Test
    @DisplayName("Missing key reads back as an empty history")
    void missingKeyIsEmpty() {
        when(listOps.range(KEY, -10, -1)).thenReturn(List.of());

        assertThat(memory.getHistory("alice").isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Unreachable Redis degrades reads to an empty history")
    void readDegradesWhenRedisDown() {
        when(listOps.range(anyString(), anyLong(), anyLong()))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThat(memory.getHistory("alice").isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Unreachable Redis turns append and clear into no-ops")
    void writeDegradesWhenRedisDown() {
        when(redisTemplate.execute(eq(RedisSessionMemory.APPEND_SCRIPT), eq(List.of(KEY)), anyString(), anyString(), anyString()))
                .thenThrow(new RedisConnectionFailureException("connection refused"));
        when(redisTemplate.delete(KEY)).thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThatCode(() -> memory.append("alice", record("q"))).doesNotThrowAnyException();
        assertThatCode(() -> memory.clear("alice")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Clear deletes the user's key")
    void clearDeletesKey() {
        memory.clear("alice");

        verify(redisTemplate).delete(KEY);
    }

    private static SessionRecord record(String query) {
        return new SessionRecord(
                Instant.parse("2026-03-01T12:30:15.123456Z"),
                query,
                Strategy.BOTH,
                2,
                "mixed internal and external topic",
                List.of("From handbook.pdf: Backups run nightly...", "From https://example.org: Offsite copies...")
        );
    }
}
