package com.example.ContextRetriever.exception;

import com.example.ContextRetriever.model.DocumentOrigin;
import lombok.Getter;

/**
 * Raised by a search adapter when its backend cannot be reached or answers with an error.
 * The orchestrator treats it as a recoverable, per-adapter failure.
 */
@Getter
public class RetrievalException extends RuntimeException {

    private final DocumentOrigin origin;

    public RetrievalException(DocumentOrigin origin, String message) {
        super(message);
        this.origin = origin;
    }

    public RetrievalException(DocumentOrigin origin, String message, Throwable cause) {
        super(message, cause);
        this.origin = origin;
    }
}
