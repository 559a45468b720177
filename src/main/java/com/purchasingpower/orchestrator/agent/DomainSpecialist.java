package com.purchasingpower.orchestrator.agent;

import com.purchasingpower.orchestrator.client.LLMProviderFactory;
import com.purchasingpower.orchestrator.exception.LLMProviderException;
import com.purchasingpower.orchestrator.model.UserContext;
import com.purchasingpower.orchestrator.registry.CapabilityRegistry;
import com.purchasingpower.orchestrator.registry.ToolContext;
import com.purchasingpower.orchestrator.service.PromptLibraryService;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Config-driven specialist: runs the domain's tools, then phrases a domain answer.
 *
 * Confidence values are placeholders, not a scoring model:
 * 0.2 when every tool failed, min(0.9, succeeded / attempted) otherwise, and the domain's
 * base confidence when no tool was needed.
 */
@Slf4j
public class DomainSpecialist implements SpecialistAgent {

    static final String PROMPT = "specialist-response";
    static final double ALL_TOOLS_FAILED_CONFIDENCE = 0.2;
    static final double TOOL_CONFIDENCE_CAP = 0.9;

    private final DomainProfile profile;
    private final CapabilityRegistry registry;
    private final ToolInvoker toolInvoker;
    private final LLMProviderFactory providerFactory;
    private final PromptLibraryService promptLibrary;
    private final Clock clock;

    public DomainSpecialist(DomainProfile profile, CapabilityRegistry registry, ToolInvoker toolInvoker,
                            LLMProviderFactory providerFactory, PromptLibraryService promptLibrary, Clock clock) {
        this.profile = profile;
        this.registry = registry;
        this.toolInvoker = toolInvoker;
        this.providerFactory = providerFactory;
        this.promptLibrary = promptLibrary;
        this.clock = clock;
    }

    @Override
    public String getDomain() {
        return profile.getName();
    }

    @Override
    public DomainProfile getProfile() {
        return profile;
    }

    @Override
    public AgentResponse handle(AgentTask task) {
        long start = System.currentTimeMillis();
        UserContext user = task.getContext().effectiveUserContext();
        ToolContext toolContext = ToolContext.of(task.getRequestId(), task.getQuery(), user, clock);
        List<String> tools = chooseTools(task.getPlannedTools(), user);
        log.info("🤖 [{}] handling request {} with tools {}", getDomain(), task.getRequestId(), tools);

        List<ToolInvocation> invocations = new ArrayList<>();
        for (String tool : tools) {
            if (Thread.currentThread().isInterrupted()) {
                return AgentResponse.failure(getDomain(), "Cancelled", tools, 0.0, elapsed(start));
            }
            invocations.add(toolInvoker.invoke(tool, task.getQuery(), task.getContext().parametersFor(tool),
                    toolContext));
        }

        long succeeded = invocations.stream().filter(ToolInvocation::success).count();
        if (!invocations.isEmpty() && succeeded == 0) {
            String errors = invocations.stream()
                    .map(invocation -> invocation.toolName() + ": " + invocation.error())
                    .collect(Collectors.joining("; "));
            log.warn("❌ [{}] every tool failed: {}", getDomain(), errors);
            return AgentResponse.failure(getDomain(), "All tools failed: " + errors, tools,
                    ALL_TOOLS_FAILED_CONFIDENCE, elapsed(start));
        }

        double confidence = invocations.isEmpty()
                ? profile.getBaseConfidence()
                : Math.min(TOOL_CONFIDENCE_CAP, (double) succeeded / invocations.size());

        Set<String> evidence = new LinkedHashSet<>();
        invocations.forEach(invocation -> evidence.addAll(invocation.evidence()));
        if (evidence.isEmpty()) {
            evidence.add("specialist:" + getDomain());
        }

        String content;
        try {
            content = phrase(task, invocations);
        } catch (LLMProviderException e) {
            log.warn("❌ [{}] answer phrasing failed: {}", getDomain(), e.getMessage());
            return AgentResponse.failure(getDomain(), "Model call failed: " + e.getMessage(), tools,
                    0.0, elapsed(start));
        }

        return AgentResponse.builder()
                .domain(getDomain())
                .content(content)
                .confidence(confidence)
                .evidence(new ArrayList<>(evidence))
                .toolsUsed(tools)
                .durationMs(elapsed(start))
                .success(true)
                .build();
    }

    /**
     * Planned tools this domain owns and the caller may use; all eligible owned tools otherwise.
     */
    List<String> chooseTools(List<String> plannedTools, UserContext user) {
        List<String> eligible = profile.getTools().stream()
                .filter(tool -> registry.isEligible(tool, user))
                .collect(Collectors.toList());
        if (plannedTools == null || plannedTools.isEmpty()) {
            return eligible;
        }
        List<String> planned = plannedTools.stream()
                .filter(eligible::contains)
                .distinct()
                .collect(Collectors.toList());
        return planned.isEmpty() ? eligible : planned;
    }

    private String phrase(AgentTask task, List<ToolInvocation> invocations) {
        List<Map<String, Object>> results = new ArrayList<>();
        for (ToolInvocation invocation : invocations) {
            Map<String, Object> row = new HashMap<>();
            row.put("tool", invocation.toolName());
            row.put("success", invocation.success());
            row.put("output", invocation.success() ? invocation.content() : invocation.error());
            results.add(row);
        }

        Map<String, Object> variables = new HashMap<>();
        variables.put("domain", getDomain());
        variables.put("description", profile.getDescription());
        variables.put("framing", profile.getPromptFraming());
        variables.put("query", task.getQuery());
        variables.put("language", task.getLanguage());
        variables.put("history", task.getContext().renderHistory());
        variables.put("toolResults", results);
        variables.put("hasToolResults", !results.isEmpty());

        String prompt = promptLibrary.render(PROMPT, variables);
        return providerFactory.getFinalResponseProvider()
                .chat(prompt, promptLibrary.optionsFor(PROMPT, task.getRequestId()))
                .trim();
    }

    private static long elapsed(long start) {
        return System.currentTimeMillis() - start;
    }
}
