package com.purchasingpower.orchestrator.selector;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Which domains handle a query, and how sure the selector was.
 *
 * {@code selectedDomains} is never empty and is already in priority order.
 */
@Value
@Builder(toBuilder = true)
public class SelectionResult implements Serializable {

    private static final long serialVersionUID = 1L;

    List<String> selectedDomains;
    double complexity;
    double confidence;
    boolean crossDomain;
    String rationale;
    int estimatedDurationSeconds;

    /**
     * Suggested tools per selected domain. Domains without an entry choose their own.
     */
    Map<String, List<String>> plannedTools;

    /**
     * True when the model answer was unusable and the fixed fallback was returned.
     */
    boolean fallback;

    public List<String> plannedToolsFor(String domain) {
        if (plannedTools == null) {
            return List.of();
        }
        return plannedTools.getOrDefault(domain, List.of());
    }

    public boolean isSingleDomain() {
        return selectedDomains.size() == 1;
    }
}
