package com.example.ContextRetriever.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single retrieval hit:
 * - content: document text or web snippet
 * - source: file/source column for local rows, URL for web hits
 * - score: higher is better; local = cosine similarity, web = engine relevance or rank proxy
 * - origin: which adapter produced it
 * - metadata: row metadata (local) or rank/query info (web), never null
 */
public record RetrievedDocument(
        String content,
        String source,
        double score,
        DocumentOrigin origin,
        Map<String, Object> metadata
) {
    public RetrievedDocument {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public RetrievedDocument(String content, String source, double score, DocumentOrigin origin) {
        this(content, source, score, origin, Map.of());
    }
}
