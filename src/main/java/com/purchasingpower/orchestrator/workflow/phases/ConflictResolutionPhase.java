package com.purchasingpower.orchestrator.workflow.phases;

import com.purchasingpower.orchestrator.synthesis.ConflictResolution;
import com.purchasingpower.orchestrator.synthesis.Synthesizer;
import com.purchasingpower.orchestrator.workflow.Phase;
import com.purchasingpower.orchestrator.workflow.RequestScope;
import com.purchasingpower.orchestrator.workflow.RequestScopeRegistry;
import com.purchasingpower.orchestrator.workflow.state.WorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class ConflictResolutionPhase {

    private final Synthesizer synthesizer;
    private final RequestScopeRegistry scopes;

    public Map<String, Object> execute(WorkflowState state) {
        RequestScope scope = scopes.require(state.getRequestId());
        ConflictResolution resolution = synthesizer.synthesize(state.getResponses(),
                state.getSelection().orElse(null),
                state.languageOr(scope.getContext().getLanguage()),
                scope.getContext());
        log.info("⚖️ [{}] resolved by {} (confidence {}, consensus {})", scope.getRequestId(),
                resolution.getMethod(), resolution.getConfidence(), resolution.getConsensusScore());

        Map<String, Object> updates = new HashMap<>();
        updates.put(WorkflowState.RESOLUTION, resolution);
        updates.put(WorkflowState.NEXT_PHASE, Phase.FINAL_RESPONSE.getNodeName());
        return updates;
    }
}
