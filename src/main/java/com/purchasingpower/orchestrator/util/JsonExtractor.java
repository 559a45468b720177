package com.purchasingpower.orchestrator.util;

import java.util.Optional;

/**
 * Pulls the JSON object out of a model completion.
 *
 * Models wrap JSON in code fences or prose; the object is taken from the first
 * '{' to the last '}'.
 */
public final class JsonExtractor {

    private JsonExtractor() {
    }

    public static Optional<String> extractObject(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String cleaned = text.replace("```json", "").replace("```", "").trim();
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return Optional.of(cleaned.substring(start, end + 1));
    }
}
