package com.example.ContextRetriever.service;

import com.example.ContextRetriever.RetrieverPropertiesFixture;
import com.example.ContextRetriever.model.SessionHistory;
import com.example.ContextRetriever.model.SessionRecord;
import com.example.ContextRetriever.model.Strategy;
import com.example.ContextRetriever.model.StrategyDecision;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.ai.chat.client.ChatClient;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StrategyClassifierTest {

    private ChatClient chatClient;
    private StrategyClassifier classifier;

    @BeforeEach
    void setUp() {
        chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        classifier = new StrategyClassifier(
                chatClient,
                new ObjectMapper(),
                RetrieverPropertiesFixture.withTimeouts(Duration.ofMillis(300))
        );
    }

    @Test
    @DisplayName("Confident single-source decision is used as proposed")
    void usesConfidentDecision() {
        reply("{\"strategy\": \"web\", \"confidence\": 0.9, \"reasoning\": \"current events\"}");

        StrategyDecision decision = classifier.classify("latest AI news", SessionHistory.empty());

        assertThat(decision.strategy()).isEqualTo(Strategy.WEB);
        assertThat(decision.confidence()).isEqualTo(0.9);
        assertThat(decision.reasoning()).isEqualTo("current events");
        assertThat(decision.contextUsed()).isFalse();
    }

    @Test
    @DisplayName("Low confidence is widened to BOTH")
    void lowConfidenceHedgesToBoth() {
        reply("{\"strategy\": \"local\", \"confidence\": 0.3, \"reasoning\": \"unsure\"}");

        StrategyDecision decision = classifier.classify("tell me more", SessionHistory.empty());

        assertThat(decision.strategy()).isEqualTo(Strategy.BOTH);
        assertThat(decision.confidence()).isEqualTo(0.3);
        assertThat(decision.reasoning()).isEqualTo("unsure");
    }

    @Test
    @DisplayName("Confidence of exactly 0.5 keeps the proposed strategy")
    void boundaryConfidenceKeepsStrategy() {
        reply("{\"strategy\": \"local\", \"confidence\": 0.5, \"reasoning\": \"internal\"}");

        assertThat(classifier.classify("policy", SessionHistory.empty()).strategy()).isEqualTo(Strategy.LOCAL);
    }

    @Test
    @DisplayName("Non-empty history marks the decision as context-aware, whatever the model says")
    void contextUsedFollowsHistory() {
        reply("{\"strategy\": \"local\", \"confidence\": 0.8, \"reasoning\": \"follow-up\", \"context_used\": false}");

        StrategyDecision decision = classifier.classify("and what about backups?", historyOf("continuity plan"));

        assertThat(decision.contextUsed()).isTrue();
    }

    @Test
    @DisplayName("Reply wrapped in a markdown fence is accepted")
    void acceptsFencedJson() {
        reply("Here you go:\n```json\n{\"strategy\": \"both\", \"confidence\": 0.7, \"reasoning\": \"mixed\"}\n```");

        assertThat(classifier.classify("compare", SessionHistory.empty()).strategy()).isEqualTo(Strategy.BOTH);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "I think you should search the web.",
            "{\"strategy\": \"custom\", \"confidence\": 0.9, \"reasoning\": \"x\"}",
            "{\"strategy\": \"web\", \"confidence\": 1.7, \"reasoning\": \"x\"}",
            "{\"strategy\": \"web\", \"confidence\": \"high\", \"reasoning\": \"x\"}",
            "{\"strategy\": \"web\", \"confidence\": 0.9}",
            "{\"strategy\": \"web\", \"confidence\": 0.9, \"reasoning\": \"x\""
    })
    @DisplayName("Unparsable replies fall back to the default decision")
    void unparsableReplyFallsBack(String raw) {
        reply(raw);

        assertThat(classifier.classify("q", historyOf("earlier"))).isEqualTo(StrategyDecision.fallback());
    }

    @Test
    @DisplayName("Unreachable reasoning service falls back to the default decision")
    void unavailableServiceFallsBack() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content())
                .thenThrow(new IllegalStateException("connection refused"));

        StrategyDecision decision = classifier.classify("q", SessionHistory.empty());

        assertThat(decision.strategy()).isEqualTo(Strategy.BOTH);
        assertThat(decision.confidence()).isZero();
        assertThat(decision.reasoning()).isEqualTo("classifier unavailable");
        assertThat(decision.contextUsed()).isFalse();
    }

    @Test
    @DisplayName("A reasoning call that outlives its timeout falls back to the default decision")
    void slowServiceFallsBack() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content())
                .thenAnswer(invocation -> {
                    Thread.sleep(2_000);
                    return "{\"strategy\": \"web\", \"confidence\": 0.9, \"reasoning\": \"late\"}";
                });

        assertThat(classifier.classify("q", SessionHistory.empty())).isEqualTo(StrategyDecision.fallback());
    }

    @Test
    @DisplayName("Prompt carries the query and history newest first")
    void promptListsHistoryNewestFirst() {
        SessionHistory history = new SessionHistory(List.of(
                record("first question", List.of("From a.pdf: alpha...")),
                record("second question", List.of("From b.pdf: beta..."))
        ));

        String text = classifier.buildPrompt("third question", history);

        assertThat(text).contains("Current Query: third question");
        assertThat(text).contains("From b.pdf: beta...");
        assertThat(text.indexOf("second question")).isLessThan(text.indexOf("first question"));
    }

    @Test
    @DisplayName("Prompt states when there is no prior conversation")
    void promptWithoutHistory() {
        assertThat(classifier.buildPrompt("hello", SessionHistory.empty()))
                .contains("No previous conversation.")
                .endsWith("Current Query: hello");
    }

    private void reply(String content) {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content()).thenReturn(content);
    }

    private static SessionHistory historyOf(String query) {
        return new SessionHistory(List.of(record(query, List.of())));
    }

    private static SessionRecord record(String query, List<String> keyPoints) {
        return new SessionRecord(Instant.parse("2026-01-01T00:00:00Z"), query, Strategy.LOCAL, keyPoints.size(),
                "r", keyPoints);
    }
}
