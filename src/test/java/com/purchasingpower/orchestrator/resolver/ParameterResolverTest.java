package com.purchasingpower.orchestrator.resolver;

import com.purchasingpower.orchestrator.exception.ParameterExtractionException;
import com.purchasingpower.orchestrator.registry.ParsedParameters;
import com.purchasingpower.orchestrator.registry.ToolSchema;
import com.purchasingpower.orchestrator.support.ScriptedLLMProvider;
import com.purchasingpower.orchestrator.support.TestFixtures;
import com.purchasingpower.orchestrator.tools.CalculatorTool;
import com.purchasingpower.orchestrator.tools.DateTimeTool;
import com.purchasingpower.orchestrator.tools.LateMinutesTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Parameter Resolver Tests")
class ParameterResolverTest {

    private ScriptedLLMProvider llm;
    private ParameterResolver resolver;

    @BeforeEach
    void setUp() {
        llm = new ScriptedLLMProvider();
        resolver = new ParameterResolver(TestFixtures.factory(llm), TestFixtures.promptLibrary(),
                TestFixtures.objectMapper());
    }

    @Test
    @DisplayName("Extracted values are typed and defaults fill optional gaps")
    void resolve_appliesDefaults() {
        // Given
        llm.on(ParameterResolver.PROMPT, "Sure! {\"expression\": \"2+2\"}");

        // When
        ParsedParameters params = resolver.resolve("calculator", "What is 2+2?",
                new CalculatorTool().getSchema(), Map.of(), null, TestFixtures.toolContext());

        // Then
        assertThat(params.getValues()).containsEntry("expression", "2+2").containsEntry("precision", 10L);
        assertThat(params.getProvenance()).containsEntry("expression", ParsedParameters.Source.EXTRACTED)
                .containsEntry("precision", ParsedParameters.Source.DEFAULT);
        assertThat(params.getAttempt()).isZero();
    }

    @Test
    @DisplayName("Caller values are kept unless the extractor overrides them")
    void resolve_mergesCallerValues() {
        // Given
        llm.on(ParameterResolver.PROMPT, "{\"operation\": \"current_time\"}");
        ToolSchema schema = new DateTimeTool().getSchema();

        // When
        ParsedParameters params = resolver.resolve("datetime", "what time is it in Tokyo?", schema,
                Map.of("timezone", "Asia/Tokyo", "undeclared", "x"), null, TestFixtures.toolContext());

        // Then
        assertThat(params.getValues()).containsEntry("timezone", "Asia/Tokyo")
                .doesNotContainKey("undeclared");
        assertThat(params.getProvenance()).containsEntry("timezone", ParsedParameters.Source.CALLER);
        assertThat(llm.promptsFor(ParameterResolver.PROMPT).get(0)).contains("\"timezone\":\"Asia/Tokyo\"");
    }

    @Test
    @DisplayName("Identical inputs produce byte-identical prompts")
    void resolve_promptIsDeterministic() {
        // Given
        llm.on(ParameterResolver.PROMPT, "{\"users\": [\"alice\"], \"time_period\": \"month\"}");
        ToolSchema schema = new LateMinutesTool().getSchema();
        Map<String, Object> caller = Map.of("time_period", "month", "checkin_time", "08:30");

        // When
        resolver.resolve("late_minutes", "How late was alice?", schema, caller, null, TestFixtures.toolContext());
        resolver.resolve("late_minutes", "How late was alice?", schema, caller, null, TestFixtures.toolContext());

        // Then
        List<String> prompts = llm.promptsFor(ParameterResolver.PROMPT);
        assertThat(prompts).hasSize(2);
        assertThat(prompts.get(0)).isEqualTo(prompts.get(1));
        assertThat(prompts.get(0)).contains("2025-01-15 10:30 (Wednesday)");
    }

    @Test
    @DisplayName("Missing required parameters are rejected with the implicated fields")
    void resolve_rejectsMissingRequired() {
        llm.on(ParameterResolver.PROMPT, "{\"time_period\": \"week\"}");

        assertThatThrownBy(() -> resolver.resolve("late_minutes", "how late?", new LateMinutesTool().getSchema(),
                Map.of(), null, TestFixtures.toolContext()))
                .isInstanceOfSatisfying(ParameterExtractionException.class, e -> {
                    assertThat(e.getFields()).containsExactly("users");
                    assertThat(e.getMessage()).contains("missing required parameter 'users'");
                });
    }

    @Test
    @DisplayName("A scalar where an array is declared is a type violation")
    void resolve_rejectsScalarForArray() {
        llm.on(ParameterResolver.PROMPT, "{\"users\": \"alice\", \"time_period\": \"week\"}");

        assertThatThrownBy(() -> resolver.resolve("late_minutes", "how late was alice?",
                new LateMinutesTool().getSchema(), Map.of(), null, TestFixtures.toolContext()))
                .isInstanceOfSatisfying(ParameterExtractionException.class, e -> {
                    assertThat(e.getFields()).containsExactly("users");
                    assertThat(e.getRejectedParameters()).containsEntry("users", "alice");
                });
    }

    @Test
    @DisplayName("Enum values outside the declared set are rejected")
    void resolve_rejectsEnumViolation() {
        llm.on(ParameterResolver.PROMPT, "{\"users\": [\"alice\"], \"time_period\": \"fortnight\"}");

        assertThatThrownBy(() -> resolver.resolve("late_minutes", "q", new LateMinutesTool().getSchema(),
                Map.of(), null, TestFixtures.toolContext()))
                .isInstanceOf(ParameterExtractionException.class)
                .hasMessageContaining("fortnight");
    }

    @Test
    @DisplayName("Enum values in another casing are accepted and stored in their declared spelling")
    void resolve_canonicalizesEnumCasing() {
        // Given
        llm.on(ParameterResolver.PROMPT, "{\"users\": [\"alice\"], \"time_period\": \" Week \"}");

        // When
        ParsedParameters params = resolver.resolve("late_minutes", "how late was alice this week?",
                new LateMinutesTool().getSchema(), Map.of(), null, TestFixtures.toolContext());

        // Then
        assertThat(params.getValues()).containsEntry("time_period", "week");
        assertThat(params.getProvenance()).containsEntry("time_period", ParsedParameters.Source.EXTRACTED);
    }

    @Test
    @DisplayName("Answers without JSON fail extraction")
    void resolve_rejectsProse() {
        llm.on(ParameterResolver.PROMPT, "I cannot help with that.");

        assertThatThrownBy(() -> resolver.resolve("calculator", "q", new CalculatorTool().getSchema(),
                Map.of(), null, TestFixtures.toolContext()))
                .isInstanceOf(ParameterExtractionException.class)
                .hasMessageContaining("no JSON");
    }

    @Test
    @DisplayName("Retry context is rendered into the prompt")
    void resolve_rendersRetryContext() {
        // Given
        llm.on(ParameterResolver.PROMPT, "{\"users\": [\"alice\"], \"time_period\": \"week\"}");
        RetryContext retry = RetryContext.builder()
                .attempt(1)
                .previousParameters(Map.of("users", "alice", "time_period", "week"))
                .errorMessage("'users' must be an array but was a string (\"alice\")")
                .implicatedFields(Set.of("users"))
                .build();

        // When
        ParsedParameters params = resolver.resolve("late_minutes", "how late was alice this week?",
                new LateMinutesTool().getSchema(), Map.of(), retry, TestFixtures.toolContext());

        // Then
        String prompt = llm.promptsFor(ParameterResolver.PROMPT).get(0);
        assertThat(prompt).contains("RETRY 1").contains("Fix these fields: users")
                .contains("{\"time_period\":\"week\",\"users\":\"alice\"}");
        assertThat(params.getAttempt()).isEqualTo(1);
    }
}
