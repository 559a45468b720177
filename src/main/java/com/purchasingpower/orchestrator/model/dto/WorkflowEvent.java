package com.purchasingpower.orchestrator.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One record of the caller-facing stream.
 *
 * Streamed fragments and discrete workflow events share this type so the caller sees a
 * single sequence. Request id, sequence, timestamp and the terminal flag are stamped by
 * the emitter; phases only build drafts with the helpers below.
 *
 * Example:
 * <pre>
 * {"requestId":"7f3c","sequence":4,"type":"response-fragment","sse_type":3,"phase":"final_response",
 *  "terminal":false,"timestamp":"2025-01-01T10:00:00Z","content":"4"}
 * </pre>
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowEvent {

    String requestId;
    long sequence;
    EventType type;
    String phase;
    boolean terminal;
    Instant timestamp;

    /**
     * Human-readable status line (start and plan events).
     */
    String message;

    /**
     * Answer fragment (response-fragment events).
     */
    String content;

    PlanPayload plan;
    List<String> followUps;
    EndPayload end;

    @JsonProperty("sse_type")
    public int getSseType() {
        return type.getTag();
    }

    // ================================================================
    // Draft helpers
    // ================================================================

    public static WorkflowEvent start(String message) {
        return WorkflowEvent.builder().type(EventType.START).phase("start").message(message).build();
    }

    public static WorkflowEvent plan(String phase, String message, PlanPayload plan) {
        return WorkflowEvent.builder().type(EventType.PLAN).phase(phase).message(message).plan(plan).build();
    }

    public static WorkflowEvent fragment(String content) {
        return WorkflowEvent.builder().type(EventType.RESPONSE_FRAGMENT).phase("final_response")
                .content(content).build();
    }

    public static WorkflowEvent followUps(List<String> questions) {
        return WorkflowEvent.builder().type(EventType.FOLLOWUP).phase("final_response")
                .followUps(List.copyOf(questions)).build();
    }

    public static WorkflowEvent end(String phase, EndPayload payload) {
        return WorkflowEvent.builder().type(EventType.END).phase(phase).end(payload).build();
    }
}
