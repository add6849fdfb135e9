package com.example.ContextRetriever.exception;

/**
 * Rejected call: the query or user id is malformed. Thrown before any session state is read.
 */
public class InvalidRetrievalRequestException extends RuntimeException {

    public InvalidRetrievalRequestException(String message) {
        super(message);
    }
}
