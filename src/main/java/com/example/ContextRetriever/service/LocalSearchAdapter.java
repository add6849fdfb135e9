package com.example.ContextRetriever.service;

import com.example.ContextRetriever.config.RetrieverProperties;
import com.example.ContextRetriever.exception.RetrievalException;
import com.example.ContextRetriever.model.DocumentOrigin;
import com.example.ContextRetriever.model.RetrievedDocument;
import com.example.ContextRetriever.repository.DocumentVectorRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Vector-similarity search over the local document store:
 * - embeds the query with the same model used for the stored documents
 * - asks pgvector for the top {@code limit} nearest rows
 * - drops rows whose similarity is below {@code retriever.similarity-threshold}
 *
 * No retries here; a failing store surfaces as {@link RetrievalException}.
 */
@Service
@RequiredArgsConstructor
public class LocalSearchAdapter implements SearchAdapter {

    private static final Logger log = LoggerFactory.getLogger(LocalSearchAdapter.class);

    private final EmbeddingModel embeddingModel;
    private final DocumentVectorRepository documentRepository;
    private final RetrieverProperties properties;

    @Override
    public DocumentOrigin origin() {
        return DocumentOrigin.LOCAL;
    }

    @Override
    public List<RetrievedDocument> search(String query, int limit) {
        if (limit <= 0) {
            return List.of();
        }

        float[] queryEmbedding;
        try {
            queryEmbedding = embeddingModel.embed(query);
        } catch (RuntimeException e) {
            throw new RetrievalException(DocumentOrigin.LOCAL, "Query embedding failed", e);
        }

        List<RetrievedDocument> candidates;
        try {
            candidates = documentRepository.findNearest(queryEmbedding, limit);
        } catch (DataAccessException e) {
            throw new RetrievalException(DocumentOrigin.LOCAL, "Vector store unreachable", e);
        }

        if (candidates == null || candidates.isEmpty()) {
            log.debug("Local search: no candidates for query='{}'", query);
            return List.of();
        }

        double threshold = properties.similarityThreshold();
        List<RetrievedDocument> kept = candidates.stream()
                .filter(doc -> doc.score() >= threshold)
                .sorted(Comparator.comparingDouble(RetrievedDocument::score).reversed())
                .toList();

        log.debug("Local search: {} of {} candidate(s) cleared threshold {}",
                kept.size(), candidates.size(), threshold);
        return kept;
    }
}
