package com.purchasingpower.orchestrator.registry;

import java.util.List;
import java.util.Map;

/**
 * Result from a tool execution.
 */
public interface ToolResult {

    boolean isSuccess();

    /**
     * Text the specialist can quote or phrase.
     */
    String getContent();

    /**
     * Structured output, empty when the tool only produces text.
     */
    Map<String, Object> getData();

    /**
     * Source identifiers backing the content.
     */
    List<String> getEvidence();

    String getError();

    /**
     * True when the failure was caused by the arguments and a repaired call may succeed.
     */
    boolean isRetryable();

    static ToolResult success(String content, Map<String, Object> data, List<String> evidence) {
        return new ToolResultImpl(true, content, Map.copyOf(data), List.copyOf(evidence), null, false);
    }

    static ToolResult success(String content, List<String> evidence) {
        return success(content, Map.of(), evidence);
    }

    static ToolResult failure(String error) {
        return new ToolResultImpl(false, "", Map.of(), List.of(), error, false);
    }

    static ToolResult invalidArguments(String error) {
        return new ToolResultImpl(false, "", Map.of(), List.of(), error, true);
    }
}

record ToolResultImpl(
        boolean success,
        String content,
        Map<String, Object> data,
        List<String> evidence,
        String error,
        boolean retryable
) implements ToolResult {

    @Override
    public boolean isSuccess() {
        return success;
    }

    @Override
    public String getContent() {
        return content;
    }

    @Override
    public Map<String, Object> getData() {
        return data;
    }

    @Override
    public List<String> getEvidence() {
        return evidence;
    }

    @Override
    public String getError() {
        return error;
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }
}
