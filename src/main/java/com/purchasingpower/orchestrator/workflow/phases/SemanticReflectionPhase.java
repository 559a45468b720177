package com.purchasingpower.orchestrator.workflow.phases;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.orchestrator.client.LLMProviderFactory;
import com.purchasingpower.orchestrator.model.QueryContext;
import com.purchasingpower.orchestrator.model.dto.PlanPayload;
import com.purchasingpower.orchestrator.model.dto.WorkflowEvent;
import com.purchasingpower.orchestrator.selector.AgentSelector;
import com.purchasingpower.orchestrator.selector.SelectionResult;
import com.purchasingpower.orchestrator.service.LocalizedMessageService;
import com.purchasingpower.orchestrator.service.PromptLibraryService;
import com.purchasingpower.orchestrator.util.JsonExtractor;
import com.purchasingpower.orchestrator.workflow.Phase;
import com.purchasingpower.orchestrator.workflow.RequestScope;
import com.purchasingpower.orchestrator.workflow.RequestScopeRegistry;
import com.purchasingpower.orchestrator.workflow.state.ReflectionResult;
import com.purchasingpower.orchestrator.workflow.state.RoutingDecision;
import com.purchasingpower.orchestrator.workflow.state.WorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies the query as chitchat or task-oriented, then selects domains for tasks.
 *
 * Output that cannot be read counts as task-oriented with the raw query. A failing model
 * call is a failure of this phase.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SemanticReflectionPhase {

    static final String PROMPT = "semantic-reflection";

    private final LLMProviderFactory providerFactory;
    private final PromptLibraryService promptLibrary;
    private final AgentSelector agentSelector;
    private final RequestScopeRegistry scopes;
    private final LocalizedMessageService messages;
    private final ObjectMapper objectMapper;

    public Map<String, Object> execute(WorkflowState state) {
        RequestScope scope = scopes.require(state.getRequestId());
        QueryContext context = scope.getContext();

        Map<String, Object> variables = new HashMap<>();
        variables.put("query", context.getQuery());
        variables.put("language", context.getLanguage());
        variables.put("history", context.renderHistory());
        String prompt = promptLibrary.render(PROMPT, variables);
        String answer = providerFactory.getToolSelectionProvider()
                .chat(prompt, promptLibrary.optionsFor(PROMPT, context.getRequestId()));

        ReflectionResult reflection = parse(answer, context);
        log.info("🔎 [{}] chitchat={}, language={}, refined='{}'", context.getRequestId(), reflection.chitchat(),
                reflection.detectedLanguage(), reflection.refinedQuery());

        Map<String, Object> updates = new HashMap<>();
        updates.put(WorkflowState.REFLECTION, reflection);
        if (reflection.chitchat()) {
            scope.emit(Phase.SEMANTIC_REFLECTION, WorkflowEvent.plan(Phase.SEMANTIC_REFLECTION.getNodeName(),
                    messages.get("status_chitchat", reflection.detectedLanguage()),
                    PlanPayload.builder()
                            .stage(PlanPayload.STAGE_SELECTION)
                            .chitchat(true)
                            .detectedLanguage(reflection.detectedLanguage())
                            .build()));
            updates.put(WorkflowState.ROUTING_DECISION, RoutingDecision.CHITCHAT);
            updates.put(WorkflowState.NEXT_PHASE, Phase.FINAL_RESPONSE.getNodeName());
            return updates;
        }

        SelectionResult selection = agentSelector.select(reflection.refinedQuery(), reflection.detectedLanguage(),
                context);
        scope.emit(Phase.SEMANTIC_REFLECTION, WorkflowEvent.plan(Phase.SEMANTIC_REFLECTION.getNodeName(),
                messages.get("status_planning", reflection.detectedLanguage()),
                PlanPayload.builder()
                        .stage(PlanPayload.STAGE_SELECTION)
                        .selectedDomains(selection.getSelectedDomains())
                        .complexity(selection.getComplexity())
                        .confidence(selection.getConfidence())
                        .crossDomain(selection.isCrossDomain())
                        .rationale(selection.getRationale())
                        .estimatedDurationSeconds(selection.getEstimatedDurationSeconds())
                        .chitchat(false)
                        .detectedLanguage(reflection.detectedLanguage())
                        .build()));
        updates.put(WorkflowState.SELECTION, selection);
        updates.put(WorkflowState.NEXT_PHASE, Phase.EXECUTE_PLANNING.getNodeName());
        return updates;
    }

    ReflectionResult parse(String answer, QueryContext context) {
        Optional<String> json = JsonExtractor.extractObject(answer);
        if (json.isEmpty()) {
            log.warn("Reflection answer had no JSON, treating query as task-oriented");
            return ReflectionResult.taskOriented(context.getLanguage(), context.getQuery());
        }
        try {
            JsonNode root = objectMapper.readTree(json.get());
            String language = root.path("detected_language").asText("");
            String refined = root.path("refined_query").asText("");
            return new ReflectionResult(
                    language.isBlank() ? context.getLanguage() : language.trim(),
                    root.path("is_chitchat").asBoolean(false),
                    refined.isBlank() ? context.getQuery() : refined.trim(),
                    root.path("summary_history").asText(""),
                    true);
        } catch (JsonProcessingException e) {
            log.warn("Reflection answer is not valid JSON ({}), treating query as task-oriented",
                    e.getOriginalMessage());
            return ReflectionResult.taskOriented(context.getLanguage(), context.getQuery());
        }
    }
}
