package com.purchasingpower.orchestrator.workflow.phases;

import com.purchasingpower.orchestrator.agent.AgentResponse;
import com.purchasingpower.orchestrator.agent.AgentTask;
import com.purchasingpower.orchestrator.agent.SpecialistAgent;
import com.purchasingpower.orchestrator.agent.SpecialistAgentPool;
import com.purchasingpower.orchestrator.config.OrchestratorConfig;
import com.purchasingpower.orchestrator.model.QueryContext;
import com.purchasingpower.orchestrator.model.dto.PlanPayload;
import com.purchasingpower.orchestrator.model.dto.WorkflowEvent;
import com.purchasingpower.orchestrator.selector.SelectionResult;
import com.purchasingpower.orchestrator.service.LocalizedMessageService;
import com.purchasingpower.orchestrator.workflow.Phase;
import com.purchasingpower.orchestrator.workflow.RequestScope;
import com.purchasingpower.orchestrator.workflow.RequestScopeRegistry;
import com.purchasingpower.orchestrator.workflow.state.PhaseFailure;
import com.purchasingpower.orchestrator.workflow.state.ReflectionResult;
import com.purchasingpower.orchestrator.workflow.state.RoutingDecision;
import com.purchasingpower.orchestrator.workflow.state.WorkflowState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Fans out one unit per selected domain and joins them under one shared deadline.
 *
 * A unit still running at the deadline is interrupted and recorded as a failed response,
 * so the response list always has one entry per selected domain, in selection order.
 */
@Slf4j
@Component
public class ExecutePlanningPhase {

    private static final Duration JOIN_MARGIN = Duration.ofSeconds(2);

    private final SpecialistAgentPool agentPool;
    private final ThreadPoolTaskExecutor specialistPool;
    private final RequestScopeRegistry scopes;
    private final OrchestratorConfig orchestratorConfig;
    private final LocalizedMessageService messages;

    public ExecutePlanningPhase(SpecialistAgentPool agentPool,
                                @Qualifier("specialistExecutor") ThreadPoolTaskExecutor specialistPool,
                                RequestScopeRegistry scopes, OrchestratorConfig orchestratorConfig,
                                LocalizedMessageService messages) {
        this.agentPool = agentPool;
        this.specialistPool = specialistPool;
        this.scopes = scopes;
        this.orchestratorConfig = orchestratorConfig;
        this.messages = messages;
    }

    public Map<String, Object> execute(WorkflowState state) {
        RequestScope scope = scopes.require(state.getRequestId());
        QueryContext context = scope.getContext();
        SelectionResult selection = state.getSelection()
                .orElseThrow(() -> new IllegalStateException("execute_planning reached without a selection"));
        String query = state.getReflection().map(ReflectionResult::refinedQuery).orElse(context.getQuery());
        String language = state.languageOr(context.getLanguage());

        long deadline = System.currentTimeMillis() + fanOutBudget().toMillis();
        Map<String, Future<AgentResponse>> units = new LinkedHashMap<>();
        Map<String, AgentResponse> immediate = new HashMap<>();
        for (String domain : selection.getSelectedDomains()) {
            scope.domainInvoked(domain);
            SpecialistAgent agent = agentPool.get(domain).orElse(null);
            if (agent == null) {
                immediate.put(domain, AgentResponse.failure(domain, "Domain is not bound", 0));
                continue;
            }
            AgentTask task = AgentTask.builder()
                    .requestId(context.getRequestId())
                    .domain(domain)
                    .query(query)
                    .language(language)
                    .context(context)
                    .plannedTools(selection.plannedToolsFor(domain))
                    .build();
            try {
                Future<AgentResponse> future = specialistPool.submit(() -> agent.handle(task));
                scope.track(future);
                units.put(domain, future);
            } catch (RejectedExecutionException e) {
                log.error("Specialist pool rejected {} for {}", domain, context.getRequestId(), e);
                immediate.put(domain, AgentResponse.failure(domain, "Specialist pool saturated", 0));
            }
        }
        log.info("🚀 [{}] fanned out to {} specialists", context.getRequestId(), units.size());

        List<AgentResponse> responses = new ArrayList<>();
        int total = selection.getSelectedDomains().size();
        for (String domain : selection.getSelectedDomains()) {
            AgentResponse response = immediate.containsKey(domain)
                    ? immediate.get(domain)
                    : join(scope, domain, units.get(domain), deadline);
            scope.toolsInvoked(response.getToolsUsed());
            if (!response.isSuccess()) {
                scope.recordFailure(new PhaseFailure(Phase.EXECUTE_PLANNING.getNodeName(), domain,
                        failureKind(response), response.getErrorDetail()));
            }
            responses.add(response);
            scope.emit(Phase.EXECUTE_PLANNING, WorkflowEvent.plan(Phase.EXECUTE_PLANNING.getNodeName(),
                    messages.get(response.isSuccess() ? "status_specialist_done" : "status_specialist_failed",
                            language) + ": " + domain,
                    PlanPayload.builder()
                            .stage(PlanPayload.STAGE_SPECIALIST)
                            .domain(domain)
                            .success(response.isSuccess())
                            .completed(responses.size())
                            .total(total)
                            .build()));
        }

        return route(scope, responses);
    }

    private AgentResponse join(RequestScope scope, String domain, Future<AgentResponse> future, long deadline) {
        long remaining = Math.max(0, deadline - System.currentTimeMillis());
        try {
            return future.get(remaining, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("⏱️ [{}] specialist {} missed the deadline", scope.getRequestId(), domain);
            return AgentResponse.failure(domain, "timed out", fanOutBudget().toMillis());
        } catch (CancellationException e) {
            return AgentResponse.failure(domain, "cancelled", 0);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("❌ [{}] specialist {} crashed", scope.getRequestId(), domain, cause);
            return AgentResponse.failure(domain, "Specialist error: " + cause.getMessage(), 0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return AgentResponse.failure(domain, "cancelled", 0);
        } finally {
            scope.untrack(future);
        }
    }

    private Map<String, Object> route(RequestScope scope, List<AgentResponse> responses) {
        long succeeded = responses.stream().filter(AgentResponse::isSuccess).count();
        Map<String, Object> updates = new HashMap<>();
        updates.put(WorkflowState.RESPONSES, new ArrayList<>(responses));
        if (succeeded == 1) {
            updates.put(WorkflowState.ROUTING_DECISION, RoutingDecision.SINGLE_RESPONSE);
            updates.put(WorkflowState.NEXT_PHASE, Phase.FINAL_RESPONSE.getNodeName());
        } else if (succeeded >= 2) {
            updates.put(WorkflowState.ROUTING_DECISION, RoutingDecision.MULTIPLE_RESPONSES);
            updates.put(WorkflowState.NEXT_PHASE, Phase.CONFLICT_RESOLUTION.getNodeName());
        } else {
            String reasons = responses.stream()
                    .map(response -> response.getDomain() + ": " + response.getErrorDetail())
                    .collect(Collectors.joining("; "));
            PhaseFailure failure = PhaseFailure.of(Phase.EXECUTE_PLANNING.getNodeName(),
                    PhaseFailure.Kind.NO_RESPONSES, reasons);
            scope.recordFailure(failure);
            updates.put(WorkflowState.FAILURE, failure);
            updates.put(WorkflowState.ROUTING_DECISION, RoutingDecision.NO_RESPONSES);
            updates.put(WorkflowState.NEXT_PHASE, Phase.ERROR.getNodeName());
        }
        log.info("🔀 [{}] {} of {} specialists succeeded -> {}", scope.getRequestId(), succeeded, responses.size(),
                updates.get(WorkflowState.NEXT_PHASE));
        return updates;
    }

    /**
     * Leaves a margin inside the phase timeout so late units are recorded before the phase itself times out.
     */
    private Duration fanOutBudget() {
        Duration phaseTimeout = orchestratorConfig.getTimeouts().getExecutePlanning();
        Duration margin = phaseTimeout.dividedBy(10).compareTo(JOIN_MARGIN) < 0
                ? phaseTimeout.dividedBy(10)
                : JOIN_MARGIN;
        return phaseTimeout.minus(margin);
    }

    private static PhaseFailure.Kind failureKind(AgentResponse response) {
        String detail = response.getErrorDetail() == null ? "" : response.getErrorDetail();
        if (detail.startsWith("timed out")) {
            return PhaseFailure.Kind.TIMEOUT;
        }
        if (detail.startsWith("cancelled") || detail.startsWith("Cancelled")) {
            return PhaseFailure.Kind.CANCELLED;
        }
        if (detail.startsWith("Model call failed")) {
            return PhaseFailure.Kind.MODEL;
        }
        return PhaseFailure.Kind.TOOL;
    }
}
