package com.example.ContextRetriever.util;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the JSON object out of a chat model reply.
 */
public final class JsonBlockExtractor {

    private JsonBlockExtractor() {
    }

    /**
     * Markdown fenced block: ```json { ... } ``` (language tag optional).
     */
    private static final Pattern FENCED = Pattern.compile(
            "```(?:json)?\\s*(\\{.*?})\\s*```",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE
    );

    /**
     * Outermost braces anywhere in the reply.
     */
    private static final Pattern BARE = Pattern.compile(
            "(\\{.*})",
            Pattern.DOTALL
    );

    public static Optional<String> extract(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        Optional<String> result = match(FENCED, trimmed);
        if (result.isPresent()) {
            return result;
        }
        return match(BARE, trimmed);
    }

    private static Optional<String> match(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String json = matcher.group(1).trim();
        return json.isEmpty() ? Optional.empty() : Optional.of(json);
    }
}
