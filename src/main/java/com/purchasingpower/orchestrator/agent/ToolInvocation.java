package com.purchasingpower.orchestrator.agent;

import com.purchasingpower.orchestrator.registry.ParsedParameters;
import com.purchasingpower.orchestrator.registry.ToolResult;

import java.util.List;

/**
 * Outcome of one tool call including every repair attempt.
 *
 * @param attempts extraction attempts made, 1 when the first one was accepted
 * @param params   the accepted parameters, null when none were ever accepted
 * @param result   the tool's result, null when the tool never ran
 */
public record ToolInvocation(String toolName, boolean success, ToolResult result, ParsedParameters params,
                             int attempts, String error) {

    static ToolInvocation succeeded(String toolName, ToolResult result, ParsedParameters params, int attempts) {
        return new ToolInvocation(toolName, true, result, params, attempts, null);
    }

    static ToolInvocation failed(String toolName, ToolResult result, ParsedParameters params, int attempts,
                                 String error) {
        return new ToolInvocation(toolName, false, result, params, attempts, error);
    }

    public String content() {
        return result == null ? "" : result.getContent();
    }

    public List<String> evidence() {
        return success && result != null ? result.getEvidence() : List.of();
    }
}
