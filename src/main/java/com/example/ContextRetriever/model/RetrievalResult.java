package com.example.ContextRetriever.model;

import java.util.List;

/**
 * Outcome of one retrieval call.
 *
 * @param query              the query as submitted
 * @param userId             the session owner
 * @param documents          merged documents, at most {@code maxDocs}
 * @param strategyUsed       strategy that was dispatched
 * @param confidence         classifier confidence behind the strategy
 * @param contextUsed        whether session history informed the decision
 * @param reasoning          classifier rationale
 * @param documentCount      size of {@code documents}
 * @param conversationLength number of history records seen before this call
 */
public record RetrievalResult(
        String query,
        String userId,
        List<RetrievedDocument> documents,
        Strategy strategyUsed,
        double confidence,
        boolean contextUsed,
        String reasoning,
        int documentCount,
        int conversationLength
) {
    public RetrievalResult {
        documents = documents == null ? List.of() : List.copyOf(documents);
    }
}
