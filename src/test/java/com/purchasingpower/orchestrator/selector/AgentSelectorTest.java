package com.purchasingpower.orchestrator.selector;

import com.purchasingpower.orchestrator.agent.SpecialistAgentPool;
import com.purchasingpower.orchestrator.config.OrchestratorConfig;
import com.purchasingpower.orchestrator.model.QueryContext;
import com.purchasingpower.orchestrator.model.UserContext;
import com.purchasingpower.orchestrator.support.ScriptedLLMProvider;
import com.purchasingpower.orchestrator.support.StubSpecialist;
import com.purchasingpower.orchestrator.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Agent Selector Tests")
class AgentSelectorTest {

    private ScriptedLLMProvider llm;
    private OrchestratorConfig config;
    private AgentSelector selector;

    @BeforeEach
    void setUp() {
        llm = new ScriptedLLMProvider();
        config = new OrchestratorConfig();
        SpecialistAgentPool pool = SpecialistAgentPool.of(List.of(
                new StubSpecialist(StubSpecialist.profile("hr", "hr", "late_minutes"), task -> null),
                new StubSpecialist(StubSpecialist.profile("finance", "public", "calculator"), task -> null),
                new StubSpecialist(StubSpecialist.profile("calculator", "public", "calculator"), task -> null),
                new StubSpecialist(StubSpecialist.profile("general", "public"), task -> null)));
        selector = new AgentSelector(TestFixtures.factory(llm), TestFixtures.promptLibrary(), pool, config,
                TestFixtures.objectMapper());
    }

    @Test
    @DisplayName("Selected domains are a subset of the bound domains")
    void select_returnsBoundSubset() {
        // Given
        llm.on(AgentSelector.PROMPT, "{\"selected_agents\": [\"calculator\"], \"complexity_score\": 0.2, "
                + "\"confidence\": 0.9, \"rationale\": \"arithmetic\", \"tool_plan\": {\"calculator\": [\"calculator\"]}}");

        // When
        SelectionResult result = selector.select("What is 2+2?", "en", context(UserContext.anonymous()));

        // Then
        assertThat(result.getSelectedDomains()).containsExactly("calculator");
        assertThat(result.getConfidence()).isEqualTo(0.9);
        assertThat(result.isCrossDomain()).isFalse();
        assertThat(result.isFallback()).isFalse();
        assertThat(result.plannedToolsFor("calculator")).containsExactly("calculator");
    }

    @Test
    @DisplayName("Unknown domains are discarded; nothing left means general at half confidence")
    void select_unknownDomainsFallBackToGeneral() {
        // Given
        llm.on(AgentSelector.PROMPT, "{\"selected_agents\": [\"astrology\"], \"complexity_score\": 0.4, "
                + "\"confidence\": 0.8, \"reasoning\": \"stars\"}");

        // When
        SelectionResult result = selector.select("Will I be lucky?", "en", context(UserContext.anonymous()));

        // Then
        assertThat(result.getSelectedDomains()).containsExactly("general");
        assertThat(result.getConfidence()).isCloseTo(0.4, within(1e-9));
        assertThat(result.getRationale()).isEqualTo("stars" + AgentSelector.ADJUSTED_NOTE);
        assertThat(result.isFallback()).isFalse();
    }

    @Test
    @DisplayName("Low complexity narrows a multi-domain answer to its first domain")
    void select_tieBreakKeepsFirst() {
        // Given
        llm.on(AgentSelector.PROMPT, "{\"selected_agents\": [\"finance\", \"calculator\"], "
                + "\"priority_order\": [\"calculator\", \"finance\"], \"complexity_score\": 0.5, \"confidence\": 0.7}");

        // When
        SelectionResult result = selector.select("Compute 5% of 200", "en", context(UserContext.anonymous()));

        // Then
        assertThat(result.getSelectedDomains()).containsExactly("calculator");
    }

    @Test
    @DisplayName("High complexity keeps several domains, capped at the configured maximum")
    void select_crossDomainCapped() {
        // Given
        config.getSelection().setMaxAgentsPerQuery(2);
        llm.on(AgentSelector.PROMPT, "{\"selected_agents\": [\"finance\", \"calculator\", \"general\"], "
                + "\"complexity_score\": 0.95, \"confidence\": 0.7, \"cross_domain\": true}");

        // When
        SelectionResult result = selector.select("Budget and math", "en", context(UserContext.anonymous()));

        // Then
        assertThat(result.getSelectedDomains()).containsExactly("finance", "calculator");
        assertThat(result.isCrossDomain()).isTrue();
    }

    @Test
    @DisplayName("Domains the caller may not access are never selected")
    void select_respectsAccess() {
        llm.on(AgentSelector.PROMPT, "{\"selected_agents\": [\"hr\"], \"complexity_score\": 0.3, \"confidence\": 0.9}");

        SelectionResult anonymous = selector.select("How late was bob?", "en", context(UserContext.anonymous()));
        SelectionResult hr = selector.select("How late was bob?", "en",
                context(UserContext.builder().role("user").department("hr").build()));

        assertThat(anonymous.getSelectedDomains()).containsExactly("general");
        assertThat(hr.getSelectedDomains()).containsExactly("hr");
        assertThat(llm.promptsFor(AgentSelector.PROMPT).get(0)).doesNotContain("- hr:");
    }

    @Test
    @DisplayName("Model failure and unparseable answers produce the fallback selection")
    void select_fallbackOnFailure() {
        // Given
        llm.failOn(AgentSelector.PROMPT);

        // When
        SelectionResult failed = selector.select("anything", "en", context(UserContext.anonymous()));

        // Then
        assertThat(failed.isFallback()).isTrue();
        assertThat(failed.getSelectedDomains()).containsExactly("general");
        assertThat(failed.getConfidence()).isEqualTo(config.getSelection().getFallbackConfidence());
        assertThat(failed.getRationale()).isEqualTo(AgentSelector.FALLBACK_RATIONALE);

        llm.reset();
        llm.on(AgentSelector.PROMPT, "not json at all");
        assertThat(selector.select("anything", "en", context(UserContext.anonymous())).isFallback()).isTrue();
    }

    @Test
    @DisplayName("Out-of-range scores are clamped")
    void select_clampsScores() {
        llm.on(AgentSelector.PROMPT, "{\"selected_agents\": [\"calculator\"], \"complexity_score\": 7, "
                + "\"confidence\": -2}");

        SelectionResult result = selector.select("2*3", "en", context(UserContext.anonymous()));

        assertThat(result.getComplexity()).isEqualTo(1.0);
        assertThat(result.getConfidence()).isEqualTo(0.0);
    }

    private static QueryContext context(UserContext user) {
        return QueryContext.builder()
                .requestId("req-1")
                .query("q")
                .language("en")
                .userContext(user)
                .history(List.of())
                .build();
    }
}
