package com.purchasingpower.orchestrator.workflow.state;

/**
 * Why the graph left a phase the way it did. Reported in the execution metadata.
 */
public enum RoutingDecision {
    CHITCHAT,
    SINGLE_RESPONSE,
    MULTIPLE_RESPONSES,
    NO_RESPONSES,
    PHASE_FAILURE,
    CANCELLED
}
