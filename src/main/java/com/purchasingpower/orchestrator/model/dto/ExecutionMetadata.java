package com.purchasingpower.orchestrator.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * What actually ran for a request. Accurate on partial success and on failure.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionMetadata {

    long elapsedMs;
    Map<String, Long> phaseDurationsMs;
    List<String> domainsInvoked;
    List<String> toolsInvoked;
    String routingDecision;
    String resolutionMethod;
    Double selectionConfidence;
    Double complexity;
    Boolean chitchat;
    String detectedLanguage;
    List<Failure> failures;

    /**
     * Only set when production-safe errors are disabled.
     */
    String technicalReason;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Failure(String phase, String domain, String kind) {
    }
}
