package com.example.ContextRetriever.util;

import com.example.ContextRetriever.model.RetrievedDocument;

import java.util.List;

public final class KeyPointExtractor {

    private KeyPointExtractor() {
    }

    /**
     * One "From &lt;source&gt;: &lt;excerpt&gt;..." line for each of the first {@code limit} documents.
     */
    public static List<String> extract(List<RetrievedDocument> documents, int limit, int excerptLength) {
        if (documents == null || documents.isEmpty() || limit <= 0) {
            return List.of();
        }
        return documents.stream()
                .limit(limit)
                .map(doc -> "From " + sourceOf(doc) + ": " + excerpt(doc.content(), excerptLength) + "...")
                .toList();
    }

    private static String sourceOf(RetrievedDocument doc) {
        return doc.source() == null || doc.source().isBlank() ? "unknown" : doc.source();
    }

    private static String excerpt(String content, int length) {
        if (content == null) {
            return "";
        }
        String flattened = content.strip().replaceAll("\\s+", " ");
        return flattened.length() > length ? flattened.substring(0, length) : flattened;
    }
}
