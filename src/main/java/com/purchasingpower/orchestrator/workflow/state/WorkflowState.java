package com.purchasingpower.orchestrator.workflow.state;

import com.purchasingpower.orchestrator.agent.AgentResponse;
import com.purchasingpower.orchestrator.selector.SelectionResult;
import com.purchasingpower.orchestrator.synthesis.ConflictResolution;
import org.bsc.langgraph4j.state.AgentState;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Graph state of one orchestration run.
 *
 * Holds only the request id and serializable phase outputs. Runtime objects of the request
 * (event emitter, futures, cancellation flag) live in its
 * {@link com.purchasingpower.orchestrator.workflow.RequestScope}.
 */
public class WorkflowState extends AgentState {

    public static final String REQUEST_ID = "requestId";
    public static final String NEXT_PHASE = "nextPhase";
    public static final String REFLECTION = "reflection";
    public static final String SELECTION = "selection";
    public static final String RESPONSES = "responses";
    public static final String ROUTING_DECISION = "routingDecision";
    public static final String RESOLUTION = "resolution";
    public static final String FAILURE = "failure";
    public static final String ANSWER = "answer";
    public static final String STATUS = "status";

    public WorkflowState(Map<String, Object> initData) {
        super(initData);
    }

    public String getRequestId() {
        return this.<String>value(REQUEST_ID).orElse(null);
    }

    public String getNextPhase() {
        return this.<String>value(NEXT_PHASE).orElse(null);
    }

    public Optional<ReflectionResult> getReflection() {
        return this.value(REFLECTION);
    }

    public Optional<SelectionResult> getSelection() {
        return this.value(SELECTION);
    }

    public List<AgentResponse> getResponses() {
        return this.<List<AgentResponse>>value(RESPONSES).orElse(List.of());
    }

    public Optional<RoutingDecision> getRoutingDecision() {
        return this.value(ROUTING_DECISION);
    }

    public Optional<ConflictResolution> getResolution() {
        return this.value(RESOLUTION);
    }

    public Optional<PhaseFailure> getFailure() {
        return this.value(FAILURE);
    }

    public String getAnswer() {
        return this.<String>value(ANSWER).orElse("");
    }

    public String getStatus() {
        return this.<String>value(STATUS).orElse(null);
    }

    public boolean isChitchat() {
        return getReflection().map(ReflectionResult::chitchat).orElse(false);
    }

    /**
     * Language for user-facing text: detected by reflection, else the requested one.
     */
    public String languageOr(String fallback) {
        return getReflection()
                .map(ReflectionResult::detectedLanguage)
                .filter(language -> !language.isBlank())
                .orElse(fallback);
    }
}
