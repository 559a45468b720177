package com.purchasingpower.orchestrator.workflow;

import com.purchasingpower.orchestrator.config.OrchestratorConfig;
import com.purchasingpower.orchestrator.model.dto.EndPayload;
import com.purchasingpower.orchestrator.model.dto.ExecutionMetadata;
import com.purchasingpower.orchestrator.selector.SelectionResult;
import com.purchasingpower.orchestrator.service.LocalizedMessageService;
import com.purchasingpower.orchestrator.workflow.state.PhaseFailure;
import com.purchasingpower.orchestrator.workflow.state.WorkflowState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds terminal payloads and their execution metadata.
 */
@Component
@RequiredArgsConstructor
public class EndEventFactory {

    private final OrchestratorConfig orchestratorConfig;
    private final LocalizedMessageService messages;

    public EndPayload completed(RequestScope scope, WorkflowState state, String answer, List<String> evidence,
                                double confidence, List<String> followUps) {
        return EndPayload.builder()
                .status(EndPayload.STATUS_COMPLETED)
                .finalAnswer(answer)
                .evidence(List.copyOf(evidence))
                .confidence(confidence)
                .followUpQuestions(List.copyOf(followUps))
                .metadata(metadata(scope, state, null))
                .build();
    }

    /**
     * @param state graph state, null when the request is ended from outside the graph
     */
    public EndPayload error(RequestScope scope, WorkflowState state, PhaseFailure failure) {
        String language = state == null
                ? scope.getContext().getLanguage()
                : state.languageOr(scope.getContext().getLanguage());
        String message = messages.get(messageKey(failure), language);
        String technical = orchestratorConfig.isProductionSafeErrors() || failure == null
                ? null
                : failure.phase() + ": " + failure.reason();
        return EndPayload.builder()
                .status(EndPayload.STATUS_ERROR)
                .finalAnswer(message)
                .evidence(List.of())
                .confidence(0.0)
                .followUpQuestions(List.of())
                .errorMessage(message)
                .metadata(metadata(scope, state, technical))
                .build();
    }

    static String messageKey(PhaseFailure failure) {
        if (failure == null) {
            return "error_generic";
        }
        switch (failure.kind()) {
            case TIMEOUT:
                return "error_timeout";
            case NO_RESPONSES:
                return "error_no_responses";
            case CANCELLED:
                return "error_cancelled";
            case MODEL:
                return "error_model_unavailable";
            default:
                return "error_generic";
        }
    }

    private ExecutionMetadata metadata(RequestScope scope, WorkflowState state, String technicalReason) {
        ExecutionMetadata.ExecutionMetadataBuilder builder = ExecutionMetadata.builder()
                .elapsedMs(scope.elapsedMs())
                .phaseDurationsMs(scope.getPhaseDurations())
                .domainsInvoked(scope.getDomainsInvoked())
                .toolsInvoked(scope.getToolsInvoked())
                .failures(scope.getFailures().stream()
                        .map(failure -> new ExecutionMetadata.Failure(failure.phase(), failure.domain(),
                                failure.kind().name()))
                        .collect(Collectors.toList()))
                .technicalReason(technicalReason);
        if (state != null) {
            state.getRoutingDecision().ifPresent(decision -> builder.routingDecision(decision.name()));
            state.getResolution().ifPresent(resolution -> builder.resolutionMethod(resolution.getMethod().name()));
            state.getSelection().ifPresent(selection -> applySelection(builder, selection));
            state.getReflection().ifPresent(reflection -> builder
                    .chitchat(reflection.chitchat())
                    .detectedLanguage(reflection.detectedLanguage()));
        }
        return builder.build();
    }

    private static void applySelection(ExecutionMetadata.ExecutionMetadataBuilder builder, SelectionResult selection) {
        builder.selectionConfidence(selection.getConfidence()).complexity(selection.getComplexity());
    }
}
