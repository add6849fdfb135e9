package com.example.ContextRetriever.model;

/**
 * A single pipeline step event streamed to the client.
 *
 * stage   - pipeline stage name: "start", "memory", "classify", "merge", "done"
 * message - human-readable description of the step
 * payload - stage specific data, e.g. history summary, decision, documents, final result
 */
public record RetrievalEvent(
        String stage,
        String message,
        Object payload
) {
}
