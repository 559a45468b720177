package com.purchasingpower.orchestrator.agent;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.util.List;

/**
 * Answer of exactly one specialist. Immutable once produced.
 */
@Value
public class AgentResponse implements Serializable {

    private static final long serialVersionUID = 1L;

    String domain;
    String content;
    double confidence;
    List<String> evidence;
    List<String> toolsUsed;
    long durationMs;
    boolean success;
    String errorDetail;

    @Builder
    private AgentResponse(String domain, String content, double confidence, List<String> evidence,
                          List<String> toolsUsed, long durationMs, boolean success, String errorDetail) {
        this.domain = domain;
        this.content = content == null ? "" : content;
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
        this.evidence = evidence == null ? List.of() : List.copyOf(evidence);
        this.toolsUsed = toolsUsed == null ? List.of() : List.copyOf(toolsUsed);
        this.durationMs = durationMs;
        this.success = success;
        this.errorDetail = errorDetail;
    }

    public static AgentResponse failure(String domain, String errorDetail, List<String> toolsUsed,
                                        double confidence, long durationMs) {
        return AgentResponse.builder()
                .domain(domain)
                .confidence(confidence)
                .toolsUsed(toolsUsed)
                .durationMs(durationMs)
                .success(false)
                .errorDetail(errorDetail)
                .build();
    }

    public static AgentResponse failure(String domain, String errorDetail, long durationMs) {
        return failure(domain, errorDetail, List.of(), 0.0, durationMs);
    }
}
