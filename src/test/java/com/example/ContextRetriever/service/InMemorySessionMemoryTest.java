package com.example.ContextRetriever.service;

import com.example.ContextRetriever.RetrieverPropertiesFixture;
import com.example.ContextRetriever.model.SessionHistory;
import com.example.ContextRetriever.model.SessionRecord;
import com.example.ContextRetriever.model.Strategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySessionMemoryTest {

    private static final int MAX_MESSAGES = 3;
    private static final Duration TTL = Duration.ofMinutes(30);

    private MutableClock clock;
    private InMemorySessionMemory memory;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T10:00:00Z"));
        memory = new InMemorySessionMemory(RetrieverPropertiesFixture.session(TTL, MAX_MESSAGES), clock);
    }

    @Test
    @DisplayName("Unknown user reads back as an empty history")
    void unknownUserIsEmpty() {
        assertThat(memory.getHistory("ghost").isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Appending past the cap evicts oldest records first")
    void evictsOldestFirst() {
        List<SessionRecord> records = IntStream.rangeClosed(1, MAX_MESSAGES + 2)
                .mapToObj(i -> record("q" + i))
                .toList();

        records.forEach(r -> memory.append("alice", r));

        SessionHistory history = memory.getHistory("alice");
        assertThat(history.records()).containsExactlyElementsOf(records.subList(2, records.size()));
        assertThat(history.size()).isEqualTo(MAX_MESSAGES);
    }

    @Test
    @DisplayName("History untouched for longer than the TTL expires")
    void expiresAfterTtl() {
        memory.append("alice", record("q1"));

        clock.advance(TTL.plusSeconds(1));

        assertThat(memory.getHistory("alice").isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Each append restarts the TTL window for the whole history")
    void appendRefreshesTtl() {
        memory.append("alice", record("q1"));
        clock.advance(TTL.minusMinutes(1));
        memory.append("alice", record("q2"));
        clock.advance(TTL.minusMinutes(1));

        assertThat(memory.getHistory("alice").records())
                .extracting(SessionRecord::query)
                .containsExactly("q1", "q2");
    }

    @Test
    @DisplayName("Appending after expiry starts a fresh history")
    void appendAfterExpiryStartsFresh() {
        memory.append("alice", record("old"));
        clock.advance(TTL.plusSeconds(1));

        memory.append("alice", record("new"));

        assertThat(memory.getHistory("alice").records())
                .extracting(SessionRecord::query)
                .containsExactly("new");
    }

    @Test
    @DisplayName("Clear removes history and is idempotent")
    void clearIsIdempotent() {
        memory.append("alice", record("q1"));

        memory.clear("alice");
        memory.clear("alice");

        assertThat(memory.getHistory("alice").isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Histories of different users are independent")
    void usersAreIsolated() {
        memory.append("alice", record("from-alice"));
        memory.append("bob", record("from-bob"));

        assertThat(memory.getHistory("alice").records()).extracting(SessionRecord::query).containsExactly("from-alice");
        assertThat(memory.getHistory("bob").records()).extracting(SessionRecord::query).containsExactly("from-bob");
    }

    @Test
    @DisplayName("Concurrent appends for one user never exceed the cap")
    void concurrentAppendsStayBounded() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Runnable> tasks = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            String query = "q" + i;
            tasks.add(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                memory.append("alice", record(query));
            });
        }
        tasks.forEach(pool::submit);
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(memory.getHistory("alice").size()).isEqualTo(MAX_MESSAGES);
    }

    private SessionRecord record(String query) {
        return new SessionRecord(clock.instant(), query, Strategy.LOCAL, 1, "because", List.of("From a: b..."));
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
