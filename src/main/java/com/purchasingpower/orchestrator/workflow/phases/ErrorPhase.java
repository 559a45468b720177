package com.purchasingpower.orchestrator.workflow.phases;

import com.purchasingpower.orchestrator.model.dto.EndPayload;
import com.purchasingpower.orchestrator.model.dto.WorkflowEvent;
import com.purchasingpower.orchestrator.workflow.EndEventFactory;
import com.purchasingpower.orchestrator.workflow.Phase;
import com.purchasingpower.orchestrator.workflow.RequestScope;
import com.purchasingpower.orchestrator.workflow.RequestScopeRegistry;
import com.purchasingpower.orchestrator.workflow.state.PhaseFailure;
import com.purchasingpower.orchestrator.workflow.state.WorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Terminal error state: emits the localized error END event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ErrorPhase {

    private final RequestScopeRegistry scopes;
    private final EndEventFactory endEvents;

    public Map<String, Object> execute(WorkflowState state) {
        RequestScope scope = scopes.require(state.getRequestId());
        PhaseFailure failure = state.getFailure().orElse(null);
        log.error("❌ [{}] workflow failed in {}: {}", scope.getRequestId(),
                failure == null ? "unknown phase" : failure.phase(),
                failure == null ? "no failure recorded" : failure.reason());

        EndPayload payload = endEvents.error(scope, state, failure);
        scope.getEmitter().emit(WorkflowEvent.end(Phase.ERROR.getNodeName(), payload));

        Map<String, Object> updates = new HashMap<>();
        updates.put(WorkflowState.STATUS, EndPayload.STATUS_ERROR);
        updates.put(WorkflowState.ANSWER, payload.getFinalAnswer());
        updates.put(WorkflowState.NEXT_PHASE, Phase.END.getNodeName());
        return updates;
    }
}
