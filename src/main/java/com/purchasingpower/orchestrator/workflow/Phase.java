package com.purchasingpower.orchestrator.workflow;

import com.purchasingpower.orchestrator.config.OrchestratorConfig;

import java.time.Duration;

/**
 * Named states of the orchestration graph.
 */
public enum Phase {
    START("start"),
    SEMANTIC_REFLECTION("semantic_reflection"),
    EXECUTE_PLANNING("execute_planning"),
    CONFLICT_RESOLUTION("conflict_resolution"),
    FINAL_RESPONSE("final_response"),
    ERROR("error"),
    END("end");

    private final String nodeName;

    Phase(String nodeName) {
        this.nodeName = nodeName;
    }

    public String getNodeName() {
        return nodeName;
    }

    public Duration timeout(OrchestratorConfig.Timeouts timeouts) {
        switch (this) {
            case SEMANTIC_REFLECTION:
                return timeouts.getSemanticReflection();
            case EXECUTE_PLANNING:
                return timeouts.getExecutePlanning();
            case CONFLICT_RESOLUTION:
                return timeouts.getConflictResolution();
            case FINAL_RESPONSE:
                return timeouts.getFinalResponse();
            default:
                return timeouts.getModelCall();
        }
    }

    public static Phase fromNodeName(String nodeName) {
        for (Phase phase : values()) {
            if (phase.nodeName.equals(nodeName)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown phase: " + nodeName);
    }
}
