package com.purchasingpower.orchestrator.selector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.orchestrator.agent.DomainProfile;
import com.purchasingpower.orchestrator.agent.SpecialistAgentPool;
import com.purchasingpower.orchestrator.client.LLMProviderFactory;
import com.purchasingpower.orchestrator.config.AgentConfig;
import com.purchasingpower.orchestrator.config.OrchestratorConfig;
import com.purchasingpower.orchestrator.model.QueryContext;
import com.purchasingpower.orchestrator.model.UserContext;
import com.purchasingpower.orchestrator.service.PromptLibraryService;
import com.purchasingpower.orchestrator.util.JsonExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * AgentSelector - asks the model which domain specialists should handle a query.
 *
 * The model answer is validated against the bound domain set; anything unusable degrades
 * to a low-confidence "general" selection. This never throws.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentSelector {

    static final String PROMPT = "agent-selector";
    static final String FALLBACK_RATIONALE = "Fallback selection due to orchestrator error";
    static final String ADJUSTED_NOTE = " (Adjusted due to agent availability)";
    private static final int MIN_DURATION_SECONDS = 5;

    private final LLMProviderFactory providerFactory;
    private final PromptLibraryService promptLibrary;
    private final SpecialistAgentPool agentPool;
    private final OrchestratorConfig orchestratorConfig;
    private final ObjectMapper objectMapper;

    public SelectionResult select(String query, String language, QueryContext context) {
        log.info("🧭 Selecting domains for: {}", query);
        List<DomainProfile> eligible = agentPool.eligibleDomains(context.effectiveUserContext());
        try {
            String prompt = buildPrompt(query, language, context, eligible);
            String answer = providerFactory.getToolSelectionProvider()
                    .chat(prompt, promptLibrary.optionsFor(PROMPT, context.getRequestId()));
            SelectionResult result = parse(answer, eligible);
            log.info("🎯 Selected {} (complexity={}, confidence={}): {}", result.getSelectedDomains(),
                    result.getComplexity(), result.getConfidence(), result.getRationale());
            return result;
        } catch (Exception e) {
            log.error("Domain selection failed, falling back to general", e);
            return fallback();
        }
    }

    public SelectionResult fallback() {
        OrchestratorConfig.Selection selection = orchestratorConfig.getSelection();
        return SelectionResult.builder()
                .selectedDomains(List.of(AgentConfig.GENERAL_DOMAIN))
                .complexity(selection.getFallbackComplexity())
                .confidence(selection.getFallbackConfidence())
                .crossDomain(false)
                .rationale(FALLBACK_RATIONALE)
                .estimatedDurationSeconds(selection.getDefaultEstimatedDurationSeconds())
                .plannedTools(Map.of())
                .fallback(true)
                .build();
    }

    private String buildPrompt(String query, String language, QueryContext context, List<DomainProfile> eligible) {
        List<Map<String, Object>> domains = new ArrayList<>();
        for (DomainProfile profile : eligible) {
            Map<String, Object> entry = new HashMap<>();
            entry.put("name", profile.getName());
            entry.put("description", profile.getDescription());
            entry.put("expertise", String.join(", ", profile.getExpertise()));
            entry.put("tools", profile.getTools().isEmpty() ? "none" : String.join(", ", profile.getTools()));
            domains.add(entry);
        }
        UserContext user = context.effectiveUserContext();

        Map<String, Object> variables = new HashMap<>();
        variables.put("query", query);
        variables.put("language", language);
        variables.put("domains", domains);
        variables.put("history", context.renderHistory());
        variables.put("role", user.getRole() == null ? "user" : user.getRole());
        variables.put("department", user.getDepartment() == null ? "unknown" : user.getDepartment());
        variables.put("maxAgents", orchestratorConfig.getSelection().getMaxAgentsPerQuery());
        return promptLibrary.render(PROMPT, variables);
    }

    SelectionResult parse(String answer, List<DomainProfile> eligible) throws IOException {
        String json = JsonExtractor.extractObject(answer)
                .orElseThrow(() -> new IllegalArgumentException("Selector answer contained no JSON object"));
        JsonNode root = objectMapper.readTree(json);
        OrchestratorConfig.Selection settings = orchestratorConfig.getSelection();

        Set<String> known = eligible.stream().map(DomainProfile::getName).collect(Collectors.toSet());
        List<String> requested = ordered(textList(root, "selected_agents", "selected_domains"),
                textList(root, "priority_order"));

        Set<String> selected = new LinkedHashSet<>();
        for (String domain : requested) {
            if (known.contains(domain)) {
                selected.add(domain);
            } else {
                log.warn("Discarding unknown domain from selector answer: {}", domain);
            }
        }

        double complexity = clamp(root.path("complexity_score").asDouble(settings.getFallbackComplexity()));
        double confidence = clamp(root.path("confidence").asDouble(settings.getFallbackConfidence()));
        String rationale = text(root, "rationale", "reasoning");
        JsonNode durationNode = root.has("estimated_duration")
                ? root.path("estimated_duration")
                : root.path("estimated_execution_time");
        int duration = Math.max(MIN_DURATION_SECONDS,
                durationNode.asInt(settings.getDefaultEstimatedDurationSeconds()));

        List<String> domains = new ArrayList<>(selected);
        if (domains.isEmpty()) {
            domains.add(AgentConfig.GENERAL_DOMAIN);
            confidence = confidence / 2;
            rationale = rationale + ADJUSTED_NOTE;
        } else if (domains.size() > 1 && complexity <= settings.getSingleAgentComplexityThreshold()) {
            log.info("Complexity {} at or below {}, narrowing {} to {}", complexity,
                    settings.getSingleAgentComplexityThreshold(), domains, domains.get(0));
            domains = new ArrayList<>(domains.subList(0, 1));
        }
        if (domains.size() > settings.getMaxAgentsPerQuery()) {
            domains = new ArrayList<>(domains.subList(0, settings.getMaxAgentsPerQuery()));
        }

        JsonNode crossNode = root.has("cross_domain") ? root.path("cross_domain") : root.path("is_cross_domain");
        boolean crossDomain = domains.size() > 1 && crossNode.asBoolean(true);
        return SelectionResult.builder()
                .selectedDomains(List.copyOf(domains))
                .complexity(complexity)
                .confidence(confidence)
                .crossDomain(crossDomain)
                .rationale(rationale)
                .estimatedDurationSeconds(duration)
                .plannedTools(toolPlan(root.path("tool_plan"), domains))
                .fallback(false)
                .build();
    }

    private static List<String> ordered(List<String> requested, List<String> priorityOrder) {
        if (priorityOrder.isEmpty()) {
            return requested;
        }
        List<String> result = new ArrayList<>();
        for (String domain : priorityOrder) {
            if (requested.contains(domain) && !result.contains(domain)) {
                result.add(domain);
            }
        }
        for (String domain : requested) {
            if (!result.contains(domain)) {
                result.add(domain);
            }
        }
        return result;
    }

    private static Map<String, List<String>> toolPlan(JsonNode node, List<String> domains) {
        Map<String, List<String>> plan = new LinkedHashMap<>();
        if (!node.isObject()) {
            return plan;
        }
        for (String domain : domains) {
            JsonNode tools = node.path(domain);
            if (tools.isArray()) {
                List<String> names = new ArrayList<>();
                tools.forEach(tool -> names.add(tool.asText().trim()));
                plan.put(domain, List.copyOf(names));
            }
        }
        return plan;
    }

    private static List<String> textList(JsonNode root, String... fields) {
        for (String field : fields) {
            JsonNode node = root.path(field);
            if (node.isArray()) {
                List<String> values = new ArrayList<>();
                node.forEach(item -> values.add(normalize(item.asText())));
                return values;
            }
            if (node.isTextual() && !node.asText().isBlank()) {
                return List.of(normalize(node.asText()));
            }
        }
        return List.of();
    }

    private static String text(JsonNode root, String... fields) {
        for (String field : fields) {
            JsonNode node = root.path(field);
            if (node.isTextual()) {
                return node.asText();
            }
        }
        return "";
    }

    private static String normalize(String domain) {
        return domain.trim().toLowerCase(Locale.ROOT);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
