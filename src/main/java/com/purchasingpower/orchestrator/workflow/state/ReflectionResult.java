package com.purchasingpower.orchestrator.workflow.state;

import java.io.Serializable;

/**
 * Output of semantic reflection.
 *
 * @param parsed false when the model answer could not be read and defaults were used
 */
public record ReflectionResult(String detectedLanguage, boolean chitchat, String refinedQuery,
                               String summaryHistory, boolean parsed) implements Serializable {

    public static ReflectionResult taskOriented(String language, String query) {
        return new ReflectionResult(language, false, query, "", false);
    }
}
