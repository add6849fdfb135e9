package com.example.ContextRetriever.service;

import com.example.ContextRetriever.config.RetrieverProperties;
import com.example.ContextRetriever.model.SessionHistory;
import com.example.ContextRetriever.model.SessionRecord;
import com.example.ContextRetriever.model.Strategy;
import com.example.ContextRetriever.model.StrategyDecision;
import com.example.ContextRetriever.util.JsonBlockExtractor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Chooses a retrieval strategy for a query with one call to the reasoning service.
 *
 * <p>The reply must be a JSON object {@code {"strategy", "confidence", "reasoning"}}.
 * Anything else, a timeout, or an unreachable service yields {@link StrategyDecision#fallback()}.
 * Decisions below {@link #MIN_CONFIDENCE} are widened to {@link Strategy#BOTH}.
 */
@Service
public class StrategyClassifier {

    private static final Logger log = LoggerFactory.getLogger(StrategyClassifier.class);

    static final double MIN_CONFIDENCE = 0.5;

    private static final int MAX_QUERY_CHARS_IN_SUMMARY = 200;

    static final String INSTRUCTIONS = """
            Analyze the user's current query together with their conversation history and
            choose the best retrieval strategy.

            Available strategies:
            - "local": the local document database (specific, internal or already discussed topics)
            - "web": web search (current events, general knowledge, topics missing locally)
            - "both": query both sources when the query spans internal and external knowledge

            Consider:
            - the intent of the current query
            - whether it builds on previous questions or asks about earlier results
            - recent events versus internal knowledge

            Respond with a single JSON object and nothing else:
            {"strategy": "local" | "web" | "both", "confidence": 0.0-1.0, "reasoning": "brief explanation"}
            """;

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper;
    private final int maxHistoryRecords;
    private final Duration timeout;

    public StrategyClassifier(@Qualifier("strategyChatClient") ChatClient chatClient,
                              ObjectMapper objectMapper,
                              RetrieverProperties properties) {
        this.chatClient = chatClient;
        this.objectMapper = objectMapper;
        this.maxHistoryRecords = properties.maxSessionMessages();
        this.timeout = properties.timeouts().classifier();
    }

    public StrategyDecision classify(String query, SessionHistory history) {
        SessionHistory safeHistory = history == null ? SessionHistory.empty() : history;
        boolean contextUsed = !safeHistory.isEmpty();
        String prompt = buildPrompt(query, safeHistory);

        String reply;
        try {
            // A timeout counts as an unavailable service
            reply = Mono.fromCallable(() -> chatClient.prompt()
                            .system(INSTRUCTIONS)
                            .user(prompt)
                            .call()
                            .content())
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            log.warn("Reasoning service unavailable, using fallback strategy: {}", e.toString());
            return StrategyDecision.fallback();
        }

        Optional<StrategyDecision> parsed = parse(reply, contextUsed);
        if (parsed.isEmpty()) {
            log.warn("Unparsable reasoning service reply, using fallback strategy: {}", abbreviate(reply));
            return StrategyDecision.fallback();
        }

        StrategyDecision decision = applyConfidencePolicy(parsed.get());
        log.debug("Classified query='{}' as {} (confidence={}, contextUsed={})",
                query, decision.strategy(), decision.confidence(), decision.contextUsed());
        return decision;
    }

    /**
     * Parse the reasoning reply. Empty when the reply does not have the expected shape.
     */
    Optional<StrategyDecision> parse(String reply, boolean contextUsed) {
        Optional<String> json = JsonBlockExtractor.extract(reply);
        if (json.isEmpty()) {
            return Optional.empty();
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(json.get());
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }

        JsonNode strategyNode = node.get("strategy");
        JsonNode confidenceNode = node.get("confidence");
        JsonNode reasoningNode = node.get("reasoning");
        if (strategyNode == null || !strategyNode.isTextual()
                || confidenceNode == null || !confidenceNode.isNumber()
                || reasoningNode == null || !reasoningNode.isTextual()) {
            return Optional.empty();
        }

        double confidence = confidenceNode.asDouble();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            return Optional.empty();
        }

        return Strategy.fromWireName(strategyNode.asText())
                .map(strategy -> new StrategyDecision(strategy, confidence, reasoningNode.asText(), contextUsed));
    }

    private StrategyDecision applyConfidencePolicy(StrategyDecision decision) {
        if (decision.confidence() < MIN_CONFIDENCE && decision.strategy() != Strategy.BOTH) {
            return new StrategyDecision(Strategy.BOTH, decision.confidence(), decision.reasoning(), decision.contextUsed());
        }
        return decision;
    }

    /**
     * Current query plus the newest history records first, each reduced to
     * query, strategy, document count and key points.
     */
    String buildPrompt(String query, SessionHistory history) {
        StringBuilder sb = new StringBuilder();
        sb.append("Conversation History:\n").append(summarizeHistory(history)).append("\n\n");
        sb.append("Current Query: ").append(query);
        return sb.toString();
    }

    private String summarizeHistory(SessionHistory history) {
        if (history.isEmpty()) {
            return "No previous conversation.";
        }

        List<SessionRecord> recent = history.mostRecentFirst(maxHistoryRecords);
        StringBuilder sb = new StringBuilder("Recent conversation (most recent first):\n");
        int index = 1;
        for (SessionRecord record : recent) {
            sb.append(index++).append(". Query: ").append(abbreviate(record.query(), MAX_QUERY_CHARS_IN_SUMMARY)).append('\n');
            sb.append("   Strategy: ").append(record.strategyUsed() == null ? "unknown" : record.strategyUsed().wireName())
                    .append(", Documents: ").append(record.documentCount()).append('\n');
            for (String keyPoint : record.keyPoints()) {
                sb.append("   - ").append(keyPoint).append('\n');
            }
        }
        return sb.toString().stripTrailing();
    }

    private static String abbreviate(String text) {
        return abbreviate(text, 200);
    }

    private static String abbreviate(String text, int max) {
        if (text == null) {
            return "(null)";
        }
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
