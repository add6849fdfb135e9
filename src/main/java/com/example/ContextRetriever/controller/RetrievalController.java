package com.example.ContextRetriever.controller;

import com.example.ContextRetriever.model.RetrievalEvent;
import com.example.ContextRetriever.model.RetrievalRequest;
import com.example.ContextRetriever.model.RetrievalResult;
import com.example.ContextRetriever.model.SessionHistory;
import com.example.ContextRetriever.service.RetrievalOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.io.IOException;

@RestController
@RequestMapping("/api/retrieval")
@RequiredArgsConstructor
public class RetrievalController {

    private final RetrievalOrchestrator retrievalOrchestrator;

    /**
     * Request example:
     *   POST /api/retrieval
     *   {
     *     "query": "What does our continuity plan say about backups?",
     *     "userId": "alice"
     *   }
     */
    @PostMapping
    public RetrievalResult retrieve(@RequestBody RetrievalRequest request) {
        return retrievalOrchestrator.retrieve(request.query(), request.userId());
    }

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamRetrieval(@RequestBody RetrievalRequest request) {
        // 0L means no timeout; every backend call inside the pipeline is already bounded
        SseEmitter emitter = new SseEmitter(0L);

        // Stages: start / memory / classify / merge / done
        Flux<RetrievalEvent> stream = retrievalOrchestrator.streamRetrieval(request.query(), request.userId());

        Disposable subscription = stream.subscribe(
                event -> {
                    try {
                        // Stage as SSE event name so clients can handle each stage separately
                        emitter.send(
                                SseEmitter.event()
                                        .name(event.stage())
                                        .data(event)
                        );
                    } catch (IOException e) {
                        emitter.completeWithError(e);
                    }
                },
                emitter::completeWithError,
                emitter::complete
        );

        // Client went away: cancel the pipeline, which also skips the session write
        emitter.onCompletion(subscription::dispose);
        emitter.onTimeout(subscription::dispose);
        emitter.onError(t -> subscription.dispose());

        return emitter;
    }

    @GetMapping("/sessions/{userId}")
    public SessionHistory conversation(@PathVariable String userId) {
        return retrievalOrchestrator.conversation(userId);
    }

    @DeleteMapping("/sessions/{userId}")
    public ResponseEntity<Void> clearSession(@PathVariable String userId) {
        retrievalOrchestrator.clearSession(userId);
        return ResponseEntity.noContent().build();
    }
}
