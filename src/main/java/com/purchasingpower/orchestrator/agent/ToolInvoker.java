package com.purchasingpower.orchestrator.agent;

import com.purchasingpower.orchestrator.config.GlobalRetryConfig;
import com.purchasingpower.orchestrator.config.OrchestratorConfig;
import com.purchasingpower.orchestrator.exception.ParameterExtractionException;
import com.purchasingpower.orchestrator.model.CallContext;
import com.purchasingpower.orchestrator.model.ServiceType;
import com.purchasingpower.orchestrator.registry.CapabilityRegistry;
import com.purchasingpower.orchestrator.registry.ParsedParameters;
import com.purchasingpower.orchestrator.registry.RegisteredCapability;
import com.purchasingpower.orchestrator.registry.ToolContext;
import com.purchasingpower.orchestrator.registry.ToolResult;
import com.purchasingpower.orchestrator.resolver.ParameterResolver;
import com.purchasingpower.orchestrator.resolver.RetryContext;
import com.purchasingpower.orchestrator.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs one tool call: extract parameters, execute, and repair on failure.
 *
 * The repair loop is bounded by {@code app.orchestrator.parameters.max-retries}. Each repair
 * sees the previous parameters, the exact error and the implicated fields. Failures end up
 * as a failed {@link ToolInvocation}, never as an exception.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolInvoker {

    private final CapabilityRegistry registry;
    private final ParameterResolver resolver;
    private final OrchestratorConfig orchestratorConfig;
    private final GlobalRetryConfig retryConfig;

    /**
     * Retry accumulator. {@code attempt} counts the attempts already made.
     */
    record RetryState(int attempt, String lastError, Map<String, Object> lastParams, Set<String> implicatedFields) {

        static RetryState initial() {
            return new RetryState(0, null, Map.of(), Set.of());
        }

        RetryState next(String error, Map<String, Object> params, Set<String> fields) {
            return new RetryState(attempt + 1, error, params == null ? Map.of() : params,
                    fields == null ? Set.of() : fields);
        }

        RetryContext toRetryContext() {
            if (attempt == 0) {
                return null;
            }
            return RetryContext.builder()
                    .attempt(attempt)
                    .previousParameters(lastParams)
                    .errorMessage(lastError)
                    .implicatedFields(implicatedFields)
                    .build();
        }
    }

    public ToolInvocation invoke(String toolName, String query, Map<String, Object> callerParams,
                                 ToolContext context) {
        Optional<RegisteredCapability> capability = registry.lookup(toolName);
        if (capability.isEmpty()) {
            log.warn("Tool {} is not registered", toolName);
            return ToolInvocation.failed(toolName, null, null, 0, "Unknown capability: " + toolName);
        }
        RegisteredCapability entry = capability.get();
        int maxAttempts = 1 + Math.max(0, orchestratorConfig.getParameters().getMaxRetries());

        RetryState state = RetryState.initial();
        ParsedParameters lastParams = null;
        ToolResult lastResult = null;
        while (state.attempt() < maxAttempts) {
            if (state.attempt() > 0 && !pause(retryConfig.backoffFor(state.attempt() - 1))) {
                return ToolInvocation.failed(toolName, lastResult, lastParams, state.attempt(), "Cancelled");
            }
            if (Thread.currentThread().isInterrupted()) {
                return ToolInvocation.failed(toolName, lastResult, lastParams, state.attempt(), "Cancelled");
            }

            ParsedParameters params;
            try {
                params = resolver.resolve(toolName, query, entry.schema(), callerParams,
                        state.toRetryContext(), context);
            } catch (ParameterExtractionException e) {
                state = state.next(e.getMessage(), e.getRejectedParameters(), e.getFields());
                continue;
            }

            lastParams = params;
            lastResult = execute(entry, params, context);
            if (lastResult.isSuccess()) {
                return ToolInvocation.succeeded(toolName, lastResult, params, state.attempt() + 1);
            }
            if (!lastResult.isRetryable()) {
                return ToolInvocation.failed(toolName, lastResult, params, state.attempt() + 1,
                        lastResult.getError());
            }
            state = state.next(lastResult.getError(), params.getValues(),
                    params.namesFrom(ParsedParameters.Source.EXTRACTED));
        }

        log.warn("❌ Tool {} gave up after {} attempts: {}", toolName, state.attempt(), state.lastError());
        return ToolInvocation.failed(toolName, lastResult, lastParams, state.attempt(), state.lastError());
    }

    private ToolResult execute(RegisteredCapability entry, ParsedParameters params, ToolContext context) {
        CallContext call = ExternalCallLogger.startCall(ServiceType.TOOL, entry.name(), context.getRequestId(), log);
        call.logRequest("revision", entry.revision(), "params", params.getValues());
        try {
            ToolResult result = entry.handle().execute(params, context);
            if (result.isSuccess()) {
                call.logResponse("content", ExternalCallLogger.truncate(result.getContent(), 200));
            } else {
                call.logError(result.getError(), null);
            }
            return result;
        } catch (RuntimeException e) {
            call.logError(e.getMessage(), e);
            return ToolResult.failure(entry.name() + " failed: " + e.getMessage());
        }
    }

    private static boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
