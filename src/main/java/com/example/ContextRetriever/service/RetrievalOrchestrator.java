package com.example.ContextRetriever.service;

import com.example.ContextRetriever.config.RetrieverProperties;
import com.example.ContextRetriever.exception.InvalidRetrievalRequestException;
import com.example.ContextRetriever.model.RetrievalEvent;
import com.example.ContextRetriever.model.RetrievalResult;
import com.example.ContextRetriever.model.RetrievalStage;
import com.example.ContextRetriever.model.RetrievedDocument;
import com.example.ContextRetriever.model.SessionHistory;
import com.example.ContextRetriever.model.SessionRecord;
import com.example.ContextRetriever.model.Strategy;
import com.example.ContextRetriever.model.StrategyDecision;
import com.example.ContextRetriever.util.KeyPointExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Context-aware retrieval, one linear pass per call:
 *
 * <pre>
 * START → MEMORY_READ → CLASSIFY → DISPATCH → MERGE → MEMORY_WRITE → DONE
 * </pre>
 *
 * Only malformed input ends in ERROR, before any session state is touched. Every collaborator
 * failure after that point degrades: empty history, fallback decision, or an adapter's results
 * being left out of the merge. Session memory is written only once merging has finished, so a
 * cancelled call leaves no record behind.
 *
 * <p>The orchestrator keeps no per-user state of its own; {@code userId} is passed through
 * every step and history lives in {@link SessionMemory}.
 */
@Service
public class RetrievalOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RetrievalOrchestrator.class);

    private static final Pattern USER_ID = Pattern.compile("[A-Za-z0-9_.:@-]{1,128}");

    private static final int PREVIEW_LENGTH = 200;

    private static final Consumer<RetrievalEvent> NO_EVENTS = event -> {
    };

    private final SessionMemory sessionMemory;
    private final StrategyClassifier strategyClassifier;
    private final LocalSearchAdapter localSearchAdapter;
    private final WebSearchAdapter webSearchAdapter;
    private final RetrieverProperties properties;

    public RetrievalOrchestrator(SessionMemory sessionMemory,
                                 StrategyClassifier strategyClassifier,
                                 LocalSearchAdapter localSearchAdapter,
                                 WebSearchAdapter webSearchAdapter,
                                 RetrieverProperties properties) {
        this.sessionMemory = sessionMemory;
        this.strategyClassifier = strategyClassifier;
        this.localSearchAdapter = localSearchAdapter;
        this.webSearchAdapter = webSearchAdapter;
        this.properties = properties;
    }

    /**
     * Blocking retrieval.
     *
     * @throws InvalidRetrievalRequestException if {@code query} or {@code userId} is malformed
     */
    public RetrievalResult retrieve(String query, String userId) {
        validate(query, userId);
        return run(query, userId, NO_EVENTS).block();
    }

    /**
     * Non-blocking retrieval with the same semantics as {@link #retrieve(String, String)}.
     * Malformed input is signalled as an error; cancelling the subscription cancels
     * in-flight searches and skips the session write.
     */
    public Mono<RetrievalResult> retrieveAsync(String query, String userId) {
        return Mono.defer(() -> {
            validate(query, userId);
            return run(query, userId, NO_EVENTS);
        });
    }

    /**
     * Retrieval that reports each stage as it completes.
     *
     * Stages:
     *  - "start": request accepted
     *  - "memory": session history loaded
     *  - "classify": strategy decided
     *  - "merge": documents merged
     *  - "done": final result, after the session write
     */
    public Flux<RetrievalEvent> streamRetrieval(String query, String userId) {
        return Flux.defer(() -> {
            validate(query, userId);
            return Flux.<RetrievalEvent>create(sink -> {
                sink.next(new RetrievalEvent(
                        "start",
                        "Request received. Starting retrieval.",
                        Map.of("ts", System.currentTimeMillis())
                ));
                Disposable subscription = run(query, userId, sink::next).subscribe(
                        result -> {
                            sink.next(new RetrievalEvent("done", "Retrieval finished.", result));
                            sink.complete();
                        },
                        sink::error
                );
                // Cancelling the stream cancels the pipeline before its session write
                sink.onDispose(subscription);
            });
        });
    }

    /**
     * Recorded history for {@code userId}, oldest first.
     */
    public SessionHistory conversation(String userId) {
        validateUserId(userId);
        return readHistory(userId);
    }

    /**
     * Explicit session reset.
     */
    public void clearSession(String userId) {
        validateUserId(userId);
        sessionMemory.clear(userId);
        log.info("Cleared session history for user={}", userId);
    }

    private Mono<RetrievalResult> run(String query, String userId, Consumer<RetrievalEvent> events) {
        log.debug("{} user={}", RetrievalStage.START, userId);
        return Mono.fromCallable(() -> readHistory(userId))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(history -> events.accept(new RetrievalEvent(
                        "memory",
                        "Loaded previous conversation for this user.",
                        summarizeHistory(history)
                )))
                .flatMap(history -> Mono.fromCallable(() -> classify(query, history))
                        .doOnNext(decision -> events.accept(new RetrievalEvent(
                                "classify",
                                "Chose retrieval strategy " + decision.strategy() + ".",
                                decision
                        )))
                        .flatMap(decision -> dispatch(query, decision)
                                .doOnNext(documents -> events.accept(new RetrievalEvent(
                                        "merge",
                                        "Merged retrieved documents.",
                                        summarizeDocuments(documents)
                                )))
                                .publishOn(Schedulers.boundedElastic())
                                .map(documents -> commit(query, userId, history, decision, documents))));
    }

    private SessionHistory readHistory(String userId) {
        log.debug("{} user={}", RetrievalStage.MEMORY_READ, userId);
        try {
            SessionHistory history = sessionMemory.getHistory(userId);
            return history == null ? SessionHistory.empty() : history;
        } catch (RuntimeException e) {
            log.warn("Session history unavailable for user={}, continuing without it", userId, e);
            return SessionHistory.empty();
        }
    }

    private StrategyDecision classify(String query, SessionHistory history) {
        log.debug("{} historySize={}", RetrievalStage.CLASSIFY, history.size());
        try {
            StrategyDecision decision = strategyClassifier.classify(query, history);
            return decision == null ? StrategyDecision.fallback() : decision;
        } catch (RuntimeException e) {
            log.warn("Strategy classification failed, using fallback decision", e);
            return StrategyDecision.fallback();
        }
    }

    /**
     * Runs the adapters the decision calls for and merges their surviving results.
     * For BOTH the two searches run concurrently and both are awaited.
     */
    private Mono<List<RetrievedDocument>> dispatch(String query, StrategyDecision decision) {
        Strategy strategy = decision.strategy();
        log.debug("{} strategy={}", RetrievalStage.DISPATCH, strategy);
        return switch (strategy) {
            case LOCAL -> searchLocal(query)
                    .map(local -> merge(strategy, local, List.of(), properties.maxDocs()));
            case WEB -> searchWeb(query)
                    .map(web -> merge(strategy, List.of(), web, properties.maxDocs()));
            case BOTH -> Mono.zip(searchLocal(query), searchWeb(query))
                    .map(results -> merge(strategy, results.getT1(), results.getT2(), properties.maxDocs()));
        };
    }

    private Mono<List<RetrievedDocument>> searchLocal(String query) {
        return search(localSearchAdapter, query, properties.maxDocs(), properties.timeouts().local());
    }

    private Mono<List<RetrievedDocument>> searchWeb(String query) {
        return search(webSearchAdapter, query, properties.webSearchMaxResults(), properties.timeouts().web());
    }

    /**
     * One adapter call, isolated: a failure or timeout becomes an empty result so the other
     * adapter's documents still reach the merge.
     */
    private Mono<List<RetrievedDocument>> search(SearchAdapter adapter, String query, int limit, Duration timeout) {
        return Mono.fromCallable(() -> adapter.search(query, limit))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .onErrorResume(e -> {
                    log.warn("{} search failed, excluding it from the merge: {}", adapter.origin(), e.toString());
                    return Mono.just(List.of());
                });
    }

    /**
     * BOTH: all documents re-ranked by raw score, descending. Scores are not normalized
     * across sources; ties keep local results ahead of web results.
     * Single source: the adapter's own order. Either way truncated to {@code maxDocs}.
     */
    static List<RetrievedDocument> merge(Strategy strategy,
                                         List<RetrievedDocument> local,
                                         List<RetrievedDocument> web,
                                         int maxDocs) {
        List<RetrievedDocument> merged = new ArrayList<>(local.size() + web.size());
        merged.addAll(local);
        merged.addAll(web);
        if (strategy == Strategy.BOTH) {
            // List.sort is stable
            merged.sort(Comparator.comparingDouble(RetrievedDocument::score).reversed());
        }
        return merged.size() > maxDocs ? List.copyOf(merged.subList(0, maxDocs)) : List.copyOf(merged);
    }

    private RetrievalResult commit(String query,
                                   String userId,
                                   SessionHistory history,
                                   StrategyDecision decision,
                                   List<RetrievedDocument> documents) {
        log.debug("{} user={} documents={}", RetrievalStage.MERGE, userId, documents.size());

        SessionRecord record = new SessionRecord(
                Instant.now(),
                query,
                decision.strategy(),
                documents.size(),
                decision.reasoning(),
                KeyPointExtractor.extract(documents, properties.keyPointLimit(), properties.keyPointLength())
        );
        log.debug("{} user={}", RetrievalStage.MEMORY_WRITE, userId);
        try {
            sessionMemory.append(userId, record);
        } catch (RuntimeException e) {
            log.warn("Could not record interaction for user={}, continuing", userId, e);
        }

        log.info("Retrieval user={} strategy={} confidence={} contextUsed={} documents={}",
                userId, decision.strategy(), decision.confidence(), decision.contextUsed(), documents.size());
        log.debug("{} user={}", RetrievalStage.DONE, userId);
        return new RetrievalResult(
                query,
                userId,
                documents,
                decision.strategy(),
                decision.confidence(),
                decision.contextUsed(),
                decision.reasoning(),
                documents.size(),
                history.size()
        );
    }

    private void validate(String query, String userId) {
        if (query == null || query.isBlank()) {
            log.debug("{} rejected: empty query", RetrievalStage.ERROR);
            throw new InvalidRetrievalRequestException("query must not be empty");
        }
        if (query.length() > properties.maxQueryLength()) {
            log.debug("{} rejected: query of {} chars", RetrievalStage.ERROR, query.length());
            throw new InvalidRetrievalRequestException(
                    "query must not exceed " + properties.maxQueryLength() + " characters");
        }
        validateUserId(userId);
    }

    private void validateUserId(String userId) {
        if (userId == null || !USER_ID.matcher(userId).matches()) {
            log.debug("{} rejected: malformed user id", RetrievalStage.ERROR);
            throw new InvalidRetrievalRequestException(
                    "userId must be 1-128 characters of letters, digits, '_', '.', ':', '@' or '-'");
        }
    }

    /**
     * Short history view for stream clients.
     */
    private List<Map<String, Object>> summarizeHistory(SessionHistory history) {
        return history.mostRecentFirst(properties.maxSessionMessages()).stream()
                .map(record -> Map.<String, Object>of(
                        "query", String.valueOf(record.query()),
                        "strategy", String.valueOf(record.strategyUsed()),
                        "documentCount", record.documentCount()
                ))
                .toList();
    }

    /**
     * Source, origin, score and a short preview of each merged document.
     */
    private List<Map<String, Object>> summarizeDocuments(List<RetrievedDocument> documents) {
        return documents.stream()
                .map(doc -> {
                    String content = doc.content();
                    String preview;
                    if (content == null) {
                        preview = "";
                    } else if (content.length() > PREVIEW_LENGTH) {
                        preview = content.substring(0, PREVIEW_LENGTH) + "...";
                    } else {
                        preview = content;
                    }

                    Map<String, Object> summary = new LinkedHashMap<>();
                    summary.put("source", doc.source());
                    summary.put("origin", doc.origin());
                    summary.put("score", doc.score());
                    summary.put("preview", preview);
                    return summary;
                })
                .toList();
    }
}
