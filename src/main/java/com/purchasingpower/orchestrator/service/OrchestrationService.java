package com.purchasingpower.orchestrator.service;

import com.purchasingpower.orchestrator.config.OrchestratorConfig;
import com.purchasingpower.orchestrator.model.QueryContext;
import com.purchasingpower.orchestrator.model.UserContext;
import com.purchasingpower.orchestrator.model.dto.EndPayload;
import com.purchasingpower.orchestrator.model.dto.QueryRequest;
import com.purchasingpower.orchestrator.model.dto.WorkflowEvent;
import com.purchasingpower.orchestrator.workflow.EndEventFactory;
import com.purchasingpower.orchestrator.workflow.OrchestrationWorkflow;
import com.purchasingpower.orchestrator.workflow.Phase;
import com.purchasingpower.orchestrator.workflow.RequestScope;
import com.purchasingpower.orchestrator.workflow.RequestScopeRegistry;
import com.purchasingpower.orchestrator.workflow.event.WorkflowEventEmitter;
import com.purchasingpower.orchestrator.workflow.state.PhaseFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point for running queries. Each submitted request gets its own id, event stream and
 * scope; the workflow itself runs on the workflow executor.
 */
@Slf4j
@Service
public class OrchestrationService {

    private final OrchestrationWorkflow workflow;
    private final RequestScopeRegistry scopes;
    private final TenantSettingsService tenantSettings;
    private final EndEventFactory endEvents;
    private final OrchestratorConfig config;
    private final ThreadPoolTaskExecutor workflowExecutor;
    private final Clock clock;

    public OrchestrationService(OrchestrationWorkflow workflow,
                                RequestScopeRegistry scopes,
                                TenantSettingsService tenantSettings,
                                EndEventFactory endEvents,
                                OrchestratorConfig config,
                                @Qualifier("workflowExecutor") ThreadPoolTaskExecutor workflowExecutor,
                                Clock clock) {
        this.workflow = workflow;
        this.scopes = scopes;
        this.tenantSettings = tenantSettings;
        this.endEvents = endEvents;
        this.config = config;
        this.workflowExecutor = workflowExecutor;
        this.clock = clock;
    }

    /**
     * Accepts a request and starts the workflow in the background.
     *
     * @throws RejectedExecutionException when the workflow pool is saturated
     */
    public RequestHandle submit(QueryRequest request) {
        QueryContext context = buildContext(request);
        String requestId = context.getRequestId();

        WorkflowEventEmitter emitter = new WorkflowEventEmitter(requestId, clock);
        RequestScope scope = new RequestScope(context, emitter, clock);
        scopes.open(scope);

        CompletableFuture<EndPayload> completion = emitter.events()
                .filter(WorkflowEvent::isTerminal)
                .next()
                .map(WorkflowEvent::getEnd)
                .toFuture();

        try {
            workflowExecutor.execute(() -> {
                try {
                    workflow.execute(requestId);
                } finally {
                    scopes.close(requestId);
                }
            });
        } catch (RejectedExecutionException e) {
            scopes.close(requestId);
            log.warn("⚠️ Workflow pool saturated, rejecting request {}", requestId);
            throw e;
        }

        log.info("📥 Accepted request {} (tenant={}, language={})", requestId, context.getTenantId(),
                context.getLanguage());
        return new RequestHandle(requestId, emitter.events(), completion);
    }

    /**
     * Cancels an in-flight request. The stream is closed with an error END right away; the
     * workflow unwinds on its own and its late events are dropped.
     *
     * @return false when the request is unknown or already finished
     */
    public boolean cancel(String requestId) {
        return scopes.find(requestId)
                .map(scope -> {
                    if (!scope.cancel()) {
                        return false;
                    }
                    PhaseFailure failure = PhaseFailure.of("request", PhaseFailure.Kind.CANCELLED,
                            "Cancelled by caller");
                    scope.recordFailure(failure);
                    EndPayload payload = endEvents.error(scope, null, failure);
                    scope.getEmitter().emit(WorkflowEvent.end(Phase.ERROR.getNodeName(), payload));
                    return true;
                })
                .orElse(false);
    }

    public int activeCount() {
        return scopes.activeCount();
    }

    QueryContext buildContext(QueryRequest request) {
        TenantSettingsService.TenantSettings tenant = tenantSettings.settingsFor(request.getTenantId());

        String language = firstNonBlank(request.getLanguage(), tenant.getLanguage(), config.getDefaultLanguage());
        QueryRequest.CallerContext caller = request.getUser();
        UserContext.UserContextBuilder user = UserContext.builder().role("user");
        String timezone = tenant.getTimezone();
        if (caller != null) {
            if (caller.getRole() != null) {
                user.role(caller.getRole());
            }
            user.department(caller.getDepartment());
            if (caller.getAccessScope() != null) {
                user.accessScope(caller.getAccessScope());
            }
            timezone = firstNonBlank(caller.getTimezone(), timezone, "UTC");
        }
        user.timezone(timezone);

        Map<String, Map<String, Object>> toolParameters = new HashMap<>();
        if (request.getToolParameters() != null) {
            request.getToolParameters().forEach((tool, params) ->
                    toolParameters.put(tool, params == null ? Map.of() : Map.copyOf(params)));
        }

        return QueryContext.builder()
                .requestId(UUID.randomUUID().toString())
                .query(request.getQuery().trim())
                .language(language)
                .tenantId(request.getTenantId())
                .userId(request.getUserId())
                .userContext(user.build())
                .history(QueryContext.window(request.getHistory(), config.getHistory().getMaxTurns()))
                .toolParameters(Map.copyOf(toolParameters))
                .receivedAt(clock.instant())
                .build();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
