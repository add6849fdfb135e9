package com.example.ContextRetriever.service;

import com.example.ContextRetriever.config.RetrieverProperties;
import com.example.ContextRetriever.exception.RetrievalException;
import com.example.ContextRetriever.model.DocumentOrigin;
import com.example.ContextRetriever.model.RetrievedDocument;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Web search over a Tavily-compatible JSON endpoint.
 *
 * <p>Request: {@code {"query": ..., "max_results": n}} with a bearer API key.
 * Response: {@code {"results": [{"title", "url", "content", "score"}]}} in engine rank order.
 * The engine's own relevance score is used when it lies in [0, 1]; otherwise the
 * score is {@code 1 / rank}.
 */
@Service
public class WebSearchAdapter implements SearchAdapter {

    private static final Logger log = LoggerFactory.getLogger(WebSearchAdapter.class);

    private final WebClient webClient;
    private final RetrieverProperties.Web settings;

    public WebSearchAdapter(@Qualifier("webSearchClient") WebClient webClient, RetrieverProperties properties) {
        this.webClient = webClient;
        this.settings = properties.web();
    }

    @Override
    public DocumentOrigin origin() {
        return DocumentOrigin.WEB;
    }

    @Override
    public List<RetrievedDocument> search(String query, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        if (settings.apiKey() == null || settings.apiKey().isBlank()) {
            throw new RetrievalException(DocumentOrigin.WEB, "Web search API key is not configured");
        }

        JsonNode response;
        try {
            response = webClient.post()
                    .uri(settings.path())
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.apiKey())
                    .bodyValue(Map.of(
                            "query", query,
                            "max_results", limit
                    ))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
        } catch (WebClientException | CodecException e) {
            throw new RetrievalException(DocumentOrigin.WEB, "Web search request failed", e);
        }

        if (response == null) {
            throw new RetrievalException(DocumentOrigin.WEB, "Web search returned an empty body");
        }
        JsonNode results = response.path("results");
        if (!results.isArray()) {
            throw new RetrievalException(DocumentOrigin.WEB, "Web search response has no results array");
        }

        List<RetrievedDocument> documents = new ArrayList<>();
        for (JsonNode hit : results) {
            if (documents.size() >= limit) {
                break;
            }
            String content = snippet(hit);
            if (content.isBlank()) {
                continue;
            }
            int rank = documents.size() + 1;
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("rank", rank);
            metadata.put("query", query);
            if (hit.hasNonNull("title")) {
                metadata.put("title", hit.get("title").asText());
            }
            String url = hit.path("url").asText("");
            documents.add(new RetrievedDocument(
                    content,
                    url.isBlank() ? "web_search" : url,
                    scoreFor(hit, rank),
                    DocumentOrigin.WEB,
                    metadata
            ));
        }

        log.debug("Web search: {} result(s) for query='{}'", documents.size(), query);
        return documents;
    }

    private static String snippet(JsonNode hit) {
        String content = hit.path("content").asText("").strip();
        String title = hit.path("title").asText("").strip();
        if (title.isEmpty()) {
            return content;
        }
        return content.isEmpty() ? title : title + "\n" + content;
    }

    static double scoreFor(JsonNode hit, int rank) {
        JsonNode engineScore = hit.get("score");
        if (engineScore != null && engineScore.isNumber()) {
            double value = engineScore.asDouble();
            if (value >= 0.0 && value <= 1.0) {
                return value;
            }
        }
        return 1.0 / rank;
    }
}
