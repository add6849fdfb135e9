package com.example.ContextRetriever.model;

/**
 * HTTP request payload for a retrieval call.
 *
 * @param query  user query text
 * @param userId session owner; history is partitioned by this id
 */
public record RetrievalRequest(
        String query,
        String userId
) {
}
