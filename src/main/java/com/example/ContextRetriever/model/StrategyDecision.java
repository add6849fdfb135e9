package com.example.ContextRetriever.model;

/**
 * Outcome of query classification.
 *
 * @param strategy    retrieval path to dispatch
 * @param confidence  classifier certainty in [0, 1]
 * @param reasoning   short rationale from the reasoning service
 * @param contextUsed whether a non-empty session history was available to the classifier
 */
public record StrategyDecision(
        Strategy strategy,
        double confidence,
        String reasoning,
        boolean contextUsed
) {
    public static final String FALLBACK_REASONING = "classifier unavailable";

    /**
     * Decision used whenever the reasoning service cannot produce a usable answer.
     */
    public static StrategyDecision fallback() {
        return new StrategyDecision(Strategy.BOTH, 0.0, FALLBACK_REASONING, false);
    }
}
