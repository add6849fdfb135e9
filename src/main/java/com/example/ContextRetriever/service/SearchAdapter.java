package com.example.ContextRetriever.service;

import com.example.ContextRetriever.exception.RetrievalException;
import com.example.ContextRetriever.model.DocumentOrigin;
import com.example.ContextRetriever.model.RetrievedDocument;

import java.util.List;

/**
 * One retrieval backend.
 */
public interface SearchAdapter {

    DocumentOrigin origin();

    /**
     * Ranked documents for {@code query}, best first, at most {@code limit} entries.
     * An empty list is a valid answer.
     *
     * @throws RetrievalException when the backend is unreachable or fails
     */
    List<RetrievedDocument> search(String query, int limit);
}
