package com.purchasingpower.orchestrator.workflow.phases;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.orchestrator.agent.AgentResponse;
import com.purchasingpower.orchestrator.client.LLMCallOptions;
import com.purchasingpower.orchestrator.client.LLMProviderFactory;
import com.purchasingpower.orchestrator.config.OrchestratorConfig;
import com.purchasingpower.orchestrator.exception.LLMProviderException;
import com.purchasingpower.orchestrator.model.QueryContext;
import com.purchasingpower.orchestrator.model.dto.EndPayload;
import com.purchasingpower.orchestrator.model.dto.WorkflowEvent;
import com.purchasingpower.orchestrator.service.LocalizedMessageService;
import com.purchasingpower.orchestrator.service.PromptLibraryService;
import com.purchasingpower.orchestrator.synthesis.ConflictResolution;
import com.purchasingpower.orchestrator.util.JsonExtractor;
import com.purchasingpower.orchestrator.workflow.EndEventFactory;
import com.purchasingpower.orchestrator.workflow.Phase;
import com.purchasingpower.orchestrator.workflow.RequestScope;
import com.purchasingpower.orchestrator.workflow.RequestScopeRegistry;
import com.purchasingpower.orchestrator.workflow.state.ReflectionResult;
import com.purchasingpower.orchestrator.workflow.state.WorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Streams the answer as fragments, adds follow-up suggestions and emits the completed END event.
 *
 * This is where upstream partial failures turn into a user-facing answer. A stream that
 * fails before its first fragment is replaced by the unphrased content; one that fails
 * later keeps what was already sent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FinalResponsePhase {

    static final String ANSWER_PROMPT = "final-response";
    static final String CHITCHAT_PROMPT = "chitchat";
    static final String FOLLOW_UP_PROMPT = "follow-up-questions";

    private final LLMProviderFactory providerFactory;
    private final PromptLibraryService promptLibrary;
    private final RequestScopeRegistry scopes;
    private final EndEventFactory endEvents;
    private final LocalizedMessageService messages;
    private final OrchestratorConfig orchestratorConfig;
    private final ObjectMapper objectMapper;

    private record Draft(String content, List<String> evidence, double confidence) {
    }

    public Map<String, Object> execute(WorkflowState state) {
        RequestScope scope = scopes.require(state.getRequestId());
        QueryContext context = scope.getContext();
        String language = state.languageOr(context.getLanguage());
        String query = state.getReflection().map(ReflectionResult::refinedQuery).orElse(context.getQuery());
        OrchestratorConfig.FinalResponse settings = orchestratorConfig.getFinalResponse();

        String answer;
        Draft draft;
        if (state.isChitchat()) {
            draft = new Draft(messages.get("chitchat_fallback", language), List.of(), 1.0);
            answer = stream(scope, CHITCHAT_PROMPT, chitchatVariables(context, language), draft.content());
        } else {
            draft = draft(state, language);
            if (settings.isPhraseAnswer()) {
                Map<String, Object> variables = new HashMap<>();
                variables.put("query", query);
                variables.put("content", draft.content());
                variables.put("language", language);
                answer = stream(scope, ANSWER_PROMPT, variables, draft.content());
            } else {
                scope.emit(Phase.FINAL_RESPONSE, WorkflowEvent.fragment(draft.content()));
                answer = draft.content();
            }
        }

        if (scope.isAbandoned(Phase.FINAL_RESPONSE)) {
            log.info("[{}] final_response was abandoned, skipping follow-ups", scope.getRequestId());
            Map<String, Object> updates = new HashMap<>();
            updates.put(WorkflowState.ANSWER, answer);
            return updates;
        }

        List<String> followUps = settings.isFollowUpsEnabled() && settings.getMaxFollowUps() > 0
                ? followUps(context, query, answer, language, settings.getMaxFollowUps())
                : List.of();
        if (!followUps.isEmpty()) {
            scope.emit(Phase.FINAL_RESPONSE, WorkflowEvent.followUps(followUps));
        }

        EndPayload payload = endEvents.completed(scope, state, answer, draft.evidence(), draft.confidence(),
                followUps);
        scope.emit(Phase.FINAL_RESPONSE, WorkflowEvent.end(Phase.FINAL_RESPONSE.getNodeName(), payload));

        Map<String, Object> updates = new HashMap<>();
        updates.put(WorkflowState.ANSWER, answer);
        updates.put(WorkflowState.STATUS, EndPayload.STATUS_COMPLETED);
        updates.put(WorkflowState.NEXT_PHASE, Phase.END.getNodeName());
        return updates;
    }

    private Draft draft(WorkflowState state, String language) {
        Optional<ConflictResolution> resolution = state.getResolution();
        if (resolution.isPresent()) {
            ConflictResolution merged = resolution.get();
            return new Draft(merged.getAnswer(), merged.getEvidence(), merged.getConfidence());
        }
        return state.getResponses().stream()
                .filter(AgentResponse::isSuccess)
                .findFirst()
                .map(response -> new Draft(response.getContent(), response.getEvidence(), response.getConfidence()))
                .orElseGet(() -> new Draft(messages.get("all_specialists_failed", language), List.of(), 0.0));
    }

    private String stream(RequestScope scope, String promptName, Map<String, Object> variables, String fallback) {
        String prompt = promptLibrary.render(promptName, variables);
        LLMCallOptions options = promptLibrary.optionsFor(promptName, scope.getRequestId());
        StringBuffer answer = new StringBuffer();
        try {
            providerFactory.getFinalResponseProvider()
                    .stream(prompt, options)
                    .filter(fragment -> !fragment.isEmpty())
                    .doOnNext(fragment -> {
                        answer.append(fragment);
                        scope.emit(Phase.FINAL_RESPONSE, WorkflowEvent.fragment(fragment));
                    })
                    .blockLast(orchestratorConfig.getTimeouts().getModelCall());
        } catch (RuntimeException e) {
            if (answer.length() == 0) {
                log.warn("[{}] answer stream failed before the first fragment, sending unphrased content: {}",
                        scope.getRequestId(), e.getMessage());
            } else {
                log.warn("[{}] answer stream failed after {} chars, keeping the partial answer: {}",
                        scope.getRequestId(), answer.length(), e.getMessage());
            }
        }
        if (answer.length() == 0) {
            scope.emit(Phase.FINAL_RESPONSE, WorkflowEvent.fragment(fallback));
            return fallback;
        }
        return answer.toString();
    }

    private Map<String, Object> chitchatVariables(QueryContext context, String language) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("query", context.getQuery());
        variables.put("language", language);
        variables.put("history", context.renderHistory());
        return variables;
    }

    /**
     * Best effort; any failure means no suggestions.
     */
    List<String> followUps(QueryContext context, String query, String answer, String language, int max) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("query", query);
        variables.put("answer", answer);
        variables.put("language", language);
        variables.put("max", max);
        try {
            String completion = providerFactory.getFinalResponseProvider().chat(
                    promptLibrary.render(FOLLOW_UP_PROMPT, variables),
                    promptLibrary.optionsFor(FOLLOW_UP_PROMPT, context.getRequestId()));
            Optional<String> json = JsonExtractor.extractObject(completion);
            if (json.isEmpty()) {
                log.debug("Follow-up answer had no JSON object");
                return List.of();
            }
            JsonNode questions = objectMapper.readTree(json.get()).path("questions");
            List<String> result = new ArrayList<>();
            for (JsonNode question : questions) {
                String text = question.asText("").trim();
                if (!text.isEmpty() && result.size() < max) {
                    result.add(text);
                }
            }
            return result;
        } catch (LLMProviderException | JsonProcessingException e) {
            log.warn("[{}] follow-up generation skipped: {}", context.getRequestId(), e.getMessage());
            return List.of();
        }
    }
}
