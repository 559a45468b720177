package com.purchasingpower.orchestrator.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Payload of the terminal event.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EndPayload {

    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_ERROR = "error";

    String status;
    String finalAnswer;
    List<String> evidence;
    double confidence;
    List<String> followUpQuestions;
    String errorMessage;
    ExecutionMetadata metadata;

    public boolean isCompleted() {
        return STATUS_COMPLETED.equals(status);
    }
}
