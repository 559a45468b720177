package com.purchasingpower.orchestrator.workflow;

import com.purchasingpower.orchestrator.model.dto.EndPayload;
import com.purchasingpower.orchestrator.model.dto.WorkflowEvent;
import com.purchasingpower.orchestrator.service.LocalizedMessageService;
import com.purchasingpower.orchestrator.workflow.phases.ConflictResolutionPhase;
import com.purchasingpower.orchestrator.workflow.phases.ErrorPhase;
import com.purchasingpower.orchestrator.workflow.phases.ExecutePlanningPhase;
import com.purchasingpower.orchestrator.workflow.phases.FinalResponsePhase;
import com.purchasingpower.orchestrator.workflow.phases.SemanticReflectionPhase;
import com.purchasingpower.orchestrator.workflow.state.PhaseFailure;
import com.purchasingpower.orchestrator.workflow.state.WorkflowState;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * The orchestration state machine.
 *
 * <pre>
 * start -> semantic_reflection -> execute_planning -> conflict_resolution -> final_response -> end
 *                    |                   |                                        ^
 *                    +---- chitchat -----+------------ single response -----------+
 * every phase -> error -> end
 * </pre>
 * Each node writes {@code nextPhase}; edges only read it, except that a cancelled request
 * always goes to {@code error}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrchestrationWorkflow {

    private final SemanticReflectionPhase semanticReflection;
    private final ExecutePlanningPhase executePlanning;
    private final ConflictResolutionPhase conflictResolution;
    private final FinalResponsePhase finalResponse;
    private final ErrorPhase errorPhase;
    private final PhaseExecutor phaseExecutor;
    private final RequestScopeRegistry scopes;
    private final EndEventFactory endEvents;
    private final LocalizedMessageService messages;

    private CompiledGraph<WorkflowState> compiledGraph;

    @PostConstruct
    public void initialize() throws GraphStateException {
        log.info("🚀 Initializing orchestration workflow graph...");
        StateGraph<WorkflowState> graph = new StateGraph<>(WorkflowState::new);

        graph.addNode(Phase.START.getNodeName(), node_async(this::start));
        graph.addNode(Phase.SEMANTIC_REFLECTION.getNodeName(), node_async(s ->
                phaseExecutor.run(Phase.SEMANTIC_REFLECTION, s, semanticReflection::execute)));
        graph.addNode(Phase.EXECUTE_PLANNING.getNodeName(), node_async(s ->
                phaseExecutor.run(Phase.EXECUTE_PLANNING, s, executePlanning::execute)));
        graph.addNode(Phase.CONFLICT_RESOLUTION.getNodeName(), node_async(s ->
                phaseExecutor.run(Phase.CONFLICT_RESOLUTION, s, conflictResolution::execute)));
        graph.addNode(Phase.FINAL_RESPONSE.getNodeName(), node_async(s ->
                phaseExecutor.run(Phase.FINAL_RESPONSE, s, finalResponse::execute)));
        graph.addNode(Phase.ERROR.getNodeName(), node_async(errorPhase::execute));

        graph.addEdge(START, Phase.START.getNodeName());
        route(graph, Phase.START, Phase.SEMANTIC_REFLECTION);
        route(graph, Phase.SEMANTIC_REFLECTION, Phase.EXECUTE_PLANNING, Phase.FINAL_RESPONSE);
        route(graph, Phase.EXECUTE_PLANNING, Phase.CONFLICT_RESOLUTION, Phase.FINAL_RESPONSE);
        route(graph, Phase.CONFLICT_RESOLUTION, Phase.FINAL_RESPONSE);
        route(graph, Phase.FINAL_RESPONSE, Phase.END);
        graph.addEdge(Phase.ERROR.getNodeName(), END);

        this.compiledGraph = graph.compile();
    }

    /**
     * Runs the graph for a request whose scope is already registered. Always leaves the
     * request's stream terminated.
     */
    public Optional<WorkflowState> execute(String requestId) {
        RequestScope scope = scopes.require(requestId);
        log.info("🚀 Starting orchestration: {}", requestId);

        Map<String, Object> input = new HashMap<>();
        input.put(WorkflowState.REQUEST_ID, requestId);
        Optional<WorkflowState> result = Optional.empty();
        try {
            result = compiledGraph.invoke(input);
            result.ifPresent(state -> log.info("🏁 Orchestration {} finished with status {}", requestId,
                    state.getStatus()));
        } catch (Exception e) {
            log.error("Workflow execution failed for {}", requestId, e);
            PhaseFailure failure = PhaseFailure.of("workflow", PhaseFailure.Kind.INTERNAL, e.getMessage());
            scope.recordFailure(failure);
            terminate(scope, failure);
        }
        if (!scope.getEmitter().isTerminated()) {
            log.error("Workflow for {} ended without a terminal event", requestId);
            terminate(scope, PhaseFailure.of("workflow", PhaseFailure.Kind.INTERNAL, "No terminal event"));
        }
        return result;
    }

    private Map<String, Object> start(WorkflowState state) {
        RequestScope scope = scopes.require(state.getRequestId());
        scope.getEmitter().emit(WorkflowEvent.start(
                messages.get("status_started", scope.getContext().getLanguage())));
        Map<String, Object> updates = new HashMap<>();
        updates.put(WorkflowState.NEXT_PHASE, Phase.SEMANTIC_REFLECTION.getNodeName());
        return updates;
    }

    private void route(StateGraph<WorkflowState> graph, Phase from, Phase... targets) throws GraphStateException {
        Map<String, String> mapping = new HashMap<>();
        for (Phase target : targets) {
            mapping.put(target.getNodeName(), target == Phase.END ? END : target.getNodeName());
        }
        mapping.put(Phase.ERROR.getNodeName(), Phase.ERROR.getNodeName());
        Set<String> allowed = mapping.keySet();

        graph.addConditionalEdges(from.getNodeName(), edge_async(s -> {
            String next = s.getNextPhase();
            boolean cancelled = scopes.find(s.getRequestId()).map(RequestScope::isCancelled).orElse(true);
            if (cancelled && !Phase.END.getNodeName().equals(next)) {
                log.info("🔀 {} -> error (request cancelled)", from.getNodeName());
                return Phase.ERROR.getNodeName();
            }
            if (next == null || !allowed.contains(next)) {
                log.error("🔀 {} produced invalid next phase '{}', routing to error", from.getNodeName(), next);
                return Phase.ERROR.getNodeName();
            }
            log.info("🔀 {} -> {}", from.getNodeName(), next);
            return next;
        }), mapping);
    }

    private void terminate(RequestScope scope, PhaseFailure failure) {
        EndPayload payload = endEvents.error(scope, null, failure);
        scope.getEmitter().emit(WorkflowEvent.end(Phase.ERROR.getNodeName(), payload));
    }
}
