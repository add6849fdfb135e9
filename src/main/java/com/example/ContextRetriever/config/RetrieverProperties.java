package com.example.ContextRetriever.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Immutable retrieval settings, bound once at startup from {@code retriever.*}.
 * Vector store and cache connections come from {@code spring.datasource.*} and
 * {@code spring.data.redis.*}.
 *
 * @param maxDocs             cap on documents returned by one retrieval call
 * @param similarityThreshold minimum cosine similarity for a local hit to be kept
 * @param webSearchMaxResults result cap passed to the web search engine
 * @param sessionTtl          rolling lifetime of a user's session history
 * @param maxSessionMessages  max records kept per user
 * @param tableName           pgvector document table
 * @param keyPointLimit       documents summarized into a session record
 * @param keyPointLength      characters kept per key point excerpt
 * @param maxQueryLength      longest accepted query
 * @param sessionStore        "redis" or "memory"
 * @param timeouts            per-call bounds on blocking I/O
 * @param web                 web search endpoint settings
 */
@ConfigurationProperties(prefix = "retriever")
public record RetrieverProperties(
        @DefaultValue("5") int maxDocs,
        @DefaultValue("0.7") double similarityThreshold,
        @DefaultValue("3") int webSearchMaxResults,
        @DefaultValue("30m") Duration sessionTtl,
        @DefaultValue("10") int maxSessionMessages,
        @DefaultValue("documents") String tableName,
        @DefaultValue("3") int keyPointLimit,
        @DefaultValue("200") int keyPointLength,
        @DefaultValue("4000") int maxQueryLength,
        @DefaultValue("redis") String sessionStore,
        @DefaultValue Timeouts timeouts,
        @DefaultValue Web web
) {

    public RetrieverProperties {
        if (maxDocs <= 0) {
            throw new IllegalArgumentException("retriever.max-docs must be positive");
        }
        if (maxSessionMessages <= 0) {
            throw new IllegalArgumentException("retriever.max-session-messages must be positive");
        }
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("retriever.similarity-threshold must be within [0, 1]");
        }
        if (sessionTtl == null || sessionTtl.isNegative() || sessionTtl.isZero()) {
            throw new IllegalArgumentException("retriever.session-ttl must be positive");
        }
    }

    public record Timeouts(
            @DefaultValue("20s") Duration classifier,
            @DefaultValue("10s") Duration local,
            @DefaultValue("8s") Duration web
    ) {
    }

    public record Web(
            @DefaultValue("https://api.tavily.com") String baseUrl,
            @DefaultValue("/search") String path,
            @DefaultValue("") String apiKey
    ) {
    }
}
