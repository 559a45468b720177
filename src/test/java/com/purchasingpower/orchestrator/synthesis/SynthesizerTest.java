package com.purchasingpower.orchestrator.synthesis;

import com.purchasingpower.orchestrator.agent.AgentResponse;
import com.purchasingpower.orchestrator.config.OrchestratorConfig;
import com.purchasingpower.orchestrator.support.ScriptedLLMProvider;
import com.purchasingpower.orchestrator.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Synthesizer Tests")
class SynthesizerTest {

    private ScriptedLLMProvider llm;
    private Synthesizer synthesizer;

    @BeforeEach
    void setUp() {
        llm = new ScriptedLLMProvider();
        synthesizer = new Synthesizer(TestFixtures.factory(llm), TestFixtures.promptLibrary(),
                TestFixtures.messages(), new OrchestratorConfig());
    }

    @Test
    @DisplayName("A single usable response is returned verbatim without a model call")
    void synthesize_singleSurvivorVerbatim() {
        // Given
        AgentResponse winner = ok("finance", "The budget is 1,200 USD.", 0.7, "ledger:2025");
        AgentResponse loser = AgentResponse.failure("hr", "Model call failed: down", 10);

        // When
        ConflictResolution resolution = synthesizer.synthesize(List.of(loser, winner), null, "en");

        // Then
        assertThat(resolution.getAnswer()).isEqualTo("The budget is 1,200 USD.");
        assertThat(resolution.getMethod()).isEqualTo(ResolutionMethod.SINGLE_WINNER);
        assertThat(resolution.getConfidence()).isEqualTo(0.7);
        assertThat(resolution.getEvidence()).containsExactly("ledger:2025");
        assertThat(resolution.getWinnerDomain()).isEqualTo("finance");
        assertThat(llm.callCount(Synthesizer.PROMPT)).isZero();
    }

    @Test
    @DisplayName("No usable response escalates with the all-failed confidence and no evidence")
    void synthesize_allFailedEscalates() {
        // When
        ConflictResolution resolution = synthesizer.synthesize(List.of(
                AgentResponse.failure("hr", "timed out", 10),
                AgentResponse.failure("it", "Specialist error: boom", 10)), null, "vi");

        // Then
        assertThat(resolution.getMethod()).isEqualTo(ResolutionMethod.ESCALATION);
        assertThat(resolution.getConfidence()).isEqualTo(0.1);
        assertThat(resolution.getEvidence()).isEmpty();
        assertThat(resolution.getConsensusScore()).isZero();
        assertThat(resolution.getAnswer()).startsWith("Xin lỗi");
    }

    @Test
    @DisplayName("Several responses are merged with capped mean confidence and deduplicated evidence")
    void synthesize_mergesSurvivors() {
        // Given
        llm.on(Synthesizer.PROMPT, "Merged answer.");
        AgentResponse a = ok("finance", "Budget is 100.", 1.0, "ledger:2025", "policy.gov");
        AgentResponse b = ok("calculator", "100 divided by 4 is 25.", 0.96, "policy.gov", "tool:calculator");

        // When
        ConflictResolution resolution = synthesizer.synthesize(List.of(a, b), null, "en");

        // Then
        assertThat(resolution.getAnswer()).isEqualTo("Merged answer.");
        assertThat(resolution.getMethod()).isEqualTo(ResolutionMethod.EVIDENCE_WEIGHTED_MERGE);
        assertThat(resolution.getConfidence()).isEqualTo(0.95);
        assertThat(resolution.getEvidence()).containsExactly("ledger:2025", "policy.gov", "tool:calculator");
        assertThat(resolution.getConsensusScore()).isCloseTo(0.96, within(1e-9));
        assertThat(llm.promptsFor(Synthesizer.PROMPT).get(0))
                .contains("[finance] confidence 1.00")
                .contains("[calculator] confidence 0.96");
    }

    @Test
    @DisplayName("A failed merge falls back to the highest-confidence response")
    void synthesize_mergeFailureFallsBack() {
        // Given
        llm.failOn(Synthesizer.PROMPT);
        AgentResponse low = ok("finance", "maybe 90", 0.4, "a");
        AgentResponse high = ok("calculator", "exactly 100", 0.8, "b");

        // When
        ConflictResolution resolution = synthesizer.synthesize(List.of(low, high), null, "en");

        // Then
        assertThat(resolution.getMethod()).isEqualTo(ResolutionMethod.SINGLE_WINNER);
        assertThat(resolution.getAnswer()).isEqualTo("exactly 100");
        assertThat(resolution.getSurvivors()).isEqualTo(2);
    }

    private static AgentResponse ok(String domain, String content, double confidence, String... evidence) {
        return AgentResponse.builder()
                .domain(domain)
                .content(content)
                .confidence(confidence)
                .evidence(List.of(evidence))
                .success(true)
                .build();
    }
}
