package com.purchasingpower.orchestrator.workflow;

import com.purchasingpower.orchestrator.config.OrchestratorConfig;
import com.purchasingpower.orchestrator.exception.LLMProviderException;
import com.purchasingpower.orchestrator.exception.PhaseTimeoutException;
import com.purchasingpower.orchestrator.workflow.state.PhaseFailure;
import com.purchasingpower.orchestrator.workflow.state.RoutingDecision;
import com.purchasingpower.orchestrator.workflow.state.WorkflowState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Runs a phase body on the phase pool under that phase's own timeout.
 *
 * A timeout, a thrown failure and a cancellation all end the same way: a
 * {@link PhaseFailure} attributed to the phase, and routing to {@code error}. A phase that
 * timed out or was cancelled is abandoned before its body is interrupted, so whatever the
 * body still tries to emit is dropped.
 */
@Slf4j
@Component
public class PhaseExecutor {

    private final ThreadPoolTaskExecutor phasePool;
    private final OrchestratorConfig orchestratorConfig;
    private final RequestScopeRegistry scopes;

    public PhaseExecutor(@Qualifier("phaseExecutor") ThreadPoolTaskExecutor phasePool,
                         OrchestratorConfig orchestratorConfig, RequestScopeRegistry scopes) {
        this.phasePool = phasePool;
        this.orchestratorConfig = orchestratorConfig;
        this.scopes = scopes;
    }

    public Map<String, Object> run(Phase phase, WorkflowState state,
                                   Function<WorkflowState, Map<String, Object>> body) {
        RequestScope scope = scopes.require(state.getRequestId());
        if (scope.isCancelled()) {
            return failed(scope, PhaseFailure.of(phase.getNodeName(), PhaseFailure.Kind.CANCELLED,
                    "Request cancelled before " + phase.getNodeName()));
        }

        Duration timeout = phase.timeout(orchestratorConfig.getTimeouts());
        log.info("▶️ [{}] {} (timeout {}ms)", scope.getRequestId(), phase.getNodeName(), timeout.toMillis());
        long started = System.currentTimeMillis();
        Future<Map<String, Object>> future;
        try {
            future = phasePool.submit(() -> body.apply(state));
        } catch (RejectedExecutionException e) {
            log.error("Phase pool rejected {} for {}", phase.getNodeName(), scope.getRequestId(), e);
            return failed(scope, PhaseFailure.of(phase.getNodeName(), PhaseFailure.Kind.INTERNAL,
                    "Phase pool saturated"));
        }
        scope.track(future);
        try {
            Map<String, Object> updates = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("✅ [{}] {} finished in {}ms -> {}", scope.getRequestId(), phase.getNodeName(),
                    System.currentTimeMillis() - started, updates.get(WorkflowState.NEXT_PHASE));
            return updates;
        } catch (TimeoutException e) {
            scope.abandon(phase);
            future.cancel(true);
            PhaseTimeoutException timeoutException = new PhaseTimeoutException(phase.getNodeName(), timeout);
            log.warn("⏱️ [{}] {}", scope.getRequestId(), timeoutException.getMessage());
            return failed(scope, PhaseFailure.of(phase.getNodeName(), PhaseFailure.Kind.TIMEOUT,
                    timeoutException.getMessage()));
        } catch (CancellationException e) {
            scope.abandon(phase);
            log.info("🛑 [{}] {} cancelled", scope.getRequestId(), phase.getNodeName());
            return failed(scope, PhaseFailure.of(phase.getNodeName(), PhaseFailure.Kind.CANCELLED,
                    "Request cancelled during " + phase.getNodeName()));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("❌ [{}] {} failed", scope.getRequestId(), phase.getNodeName(), cause);
            PhaseFailure.Kind kind = cause instanceof LLMProviderException
                    ? PhaseFailure.Kind.MODEL
                    : PhaseFailure.Kind.INTERNAL;
            return failed(scope, PhaseFailure.of(phase.getNodeName(), kind, String.valueOf(cause.getMessage())));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scope.abandon(phase);
            future.cancel(true);
            return failed(scope, PhaseFailure.of(phase.getNodeName(), PhaseFailure.Kind.CANCELLED,
                    "Interrupted during " + phase.getNodeName()));
        } finally {
            scope.untrack(future);
            scope.recordPhaseDuration(phase, System.currentTimeMillis() - started);
        }
    }

    private static Map<String, Object> failed(RequestScope scope, PhaseFailure failure) {
        scope.recordFailure(failure);
        Map<String, Object> updates = new HashMap<>();
        updates.put(WorkflowState.FAILURE, failure);
        updates.put(WorkflowState.ROUTING_DECISION, failure.kind() == PhaseFailure.Kind.CANCELLED
                ? RoutingDecision.CANCELLED
                : RoutingDecision.PHASE_FAILURE);
        updates.put(WorkflowState.NEXT_PHASE, Phase.ERROR.getNodeName());
        return updates;
    }
}
