package com.purchasingpower.orchestrator.synthesis;

import com.purchasingpower.orchestrator.agent.AgentResponse;
import com.purchasingpower.orchestrator.client.LLMProviderFactory;
import com.purchasingpower.orchestrator.config.OrchestratorConfig;
import com.purchasingpower.orchestrator.exception.LLMProviderException;
import com.purchasingpower.orchestrator.model.QueryContext;
import com.purchasingpower.orchestrator.selector.SelectionResult;
import com.purchasingpower.orchestrator.service.LocalizedMessageService;
import com.purchasingpower.orchestrator.service.PromptLibraryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Synthesizer - reconciles several specialist responses into one answer.
 *
 * <ul>
 *   <li>one surviving response: returned unchanged, no model call</li>
 *   <li>no surviving response: fixed escalation answer with the all-failed confidence</li>
 *   <li>several: model merge, mean confidence capped, evidence deduplicated</li>
 * </ul>
 * A failed merge call falls back to the highest-confidence survivor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Synthesizer {

    static final String PROMPT = "synthesis";
    static final String ALL_FAILED_KEY = "all_specialists_failed";

    private final LLMProviderFactory providerFactory;
    private final PromptLibraryService promptLibrary;
    private final LocalizedMessageService messages;
    private final OrchestratorConfig orchestratorConfig;

    public ConflictResolution synthesize(List<AgentResponse> responses, SelectionResult selection, String language) {
        return synthesize(responses, selection, language, null);
    }

    /**
     * @param context original request, used for the merge prompt; may be null
     */
    public ConflictResolution synthesize(List<AgentResponse> responses, SelectionResult selection,
                                         String language, QueryContext context) {
        int participants = responses.size();
        List<AgentResponse> survivors = responses.stream()
                .filter(AgentResponse::isSuccess)
                .sorted(Comparator.comparingDouble(AgentResponse::getConfidence).reversed())
                .collect(Collectors.toList());
        log.info("⚖️ Synthesizing {} responses ({} usable) for {}", participants, survivors.size(),
                selection == null ? "-" : selection.getSelectedDomains());

        if (survivors.isEmpty()) {
            return escalation(participants, language);
        }
        if (survivors.size() == 1) {
            return singleWinner(survivors.get(0), participants, 1);
        }

        List<String> evidence = mergedEvidence(survivors);
        EvidenceAnalysis analysis = EvidenceAnalyzer.analyze(evidence);
        try {
            String merged = merge(survivors, analysis, language, context);
            double mean = survivors.stream().mapToDouble(AgentResponse::getConfidence).average().orElse(0.0);
            double confidence = Math.min(orchestratorConfig.getSynthesis().getConfidenceCap(), mean);
            return ConflictResolution.builder()
                    .answer(merged)
                    .evidence(evidence)
                    .confidence(confidence)
                    .method(ResolutionMethod.EVIDENCE_WEIGHTED_MERGE)
                    .consensusScore(consensus(survivors, participants))
                    .participants(participants)
                    .survivors(survivors.size())
                    .evidenceAnalysis(analysis)
                    .build();
        } catch (LLMProviderException e) {
            log.warn("Synthesis call failed, using highest-confidence response from {}: {}",
                    survivors.get(0).getDomain(), e.getMessage());
            return singleWinner(survivors.get(0), participants, survivors.size());
        }
    }

    private ConflictResolution singleWinner(AgentResponse winner, int participants, int survivors) {
        return ConflictResolution.builder()
                .answer(winner.getContent())
                .evidence(winner.getEvidence())
                .confidence(winner.getConfidence())
                .method(ResolutionMethod.SINGLE_WINNER)
                .consensusScore(1.0)
                .winnerDomain(winner.getDomain())
                .participants(participants)
                .survivors(survivors)
                .evidenceAnalysis(EvidenceAnalyzer.analyze(winner.getEvidence()))
                .build();
    }

    private ConflictResolution escalation(int participants, String language) {
        log.warn("❌ No specialist produced a usable response");
        return ConflictResolution.builder()
                .answer(messages.get(ALL_FAILED_KEY, language))
                .evidence(List.of())
                .confidence(orchestratorConfig.getSynthesis().getAllFailedConfidence())
                .method(ResolutionMethod.ESCALATION)
                .consensusScore(0.0)
                .participants(participants)
                .survivors(0)
                .evidenceAnalysis(EvidenceAnalysis.empty())
                .build();
    }

    private String merge(List<AgentResponse> survivors, EvidenceAnalysis analysis, String language,
                         QueryContext context) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (AgentResponse response : survivors) {
            Map<String, Object> row = new HashMap<>();
            row.put("domain", response.getDomain());
            row.put("content", response.getContent());
            row.put("confidence", String.format(Locale.ROOT, "%.2f", response.getConfidence()));
            row.put("evidence", String.join(", ", response.getEvidence()));
            rows.add(row);
        }

        Map<String, Object> variables = new HashMap<>();
        variables.put("query", context == null ? "" : context.getQuery());
        variables.put("language", language);
        variables.put("responses", rows);
        variables.put("totalSources", analysis.totalSources());
        variables.put("reliability", String.format(Locale.ROOT, "%.2f", analysis.reliability()));
        variables.put("completeness", String.format(Locale.ROOT, "%.2f", analysis.completeness()));

        String prompt = promptLibrary.render(PROMPT, variables);
        String requestId = context == null ? null : context.getRequestId();
        String merged = providerFactory.getFinalResponseProvider()
                .chat(prompt, promptLibrary.optionsFor(PROMPT, requestId));
        if (merged == null || merged.isBlank()) {
            throw new LLMProviderException(providerFactory.getFinalResponseProvider().getProviderName(), PROMPT,
                    "Empty synthesis answer", null);
        }
        return merged.trim();
    }

    /**
     * Survivors are already sorted by confidence, so evidence of stronger responses comes first.
     */
    private static List<String> mergedEvidence(List<AgentResponse> survivors) {
        Set<String> evidence = new LinkedHashSet<>();
        survivors.forEach(response -> evidence.addAll(response.getEvidence()));
        return List.copyOf(evidence);
    }

    private static double consensus(List<AgentResponse> survivors, int participants) {
        double max = survivors.stream().mapToDouble(AgentResponse::getConfidence).max().orElse(0.0);
        double min = survivors.stream().mapToDouble(AgentResponse::getConfidence).min().orElse(0.0);
        return ((double) survivors.size() / participants) * (1.0 - (max - min));
    }
}
