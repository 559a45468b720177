package com.purchasingpower.orchestrator.agent;

import com.purchasingpower.orchestrator.config.GlobalRetryConfig;
import com.purchasingpower.orchestrator.config.OrchestratorConfig;
import com.purchasingpower.orchestrator.model.UserContext;
import com.purchasingpower.orchestrator.registry.CapabilityRegistry;
import com.purchasingpower.orchestrator.registry.ParameterSpec;
import com.purchasingpower.orchestrator.registry.ParameterType;
import com.purchasingpower.orchestrator.registry.ParsedParameters;
import com.purchasingpower.orchestrator.registry.Tool;
import com.purchasingpower.orchestrator.registry.ToolContext;
import com.purchasingpower.orchestrator.registry.ToolResult;
import com.purchasingpower.orchestrator.registry.ToolSchema;
import com.purchasingpower.orchestrator.resolver.ParameterResolver;
import com.purchasingpower.orchestrator.support.ScriptedLLMProvider;
import com.purchasingpower.orchestrator.support.TestFixtures;
import com.purchasingpower.orchestrator.tools.CalculatorTool;
import com.purchasingpower.orchestrator.tools.LateMinutesTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Tool Invoker Tests")
class ToolInvokerTest {

    private static final String EXTRACTOR = "parameter-extractor";

    private ScriptedLLMProvider llm;
    private CapabilityRegistry registry;
    private ToolInvoker invoker;
    private final ToolContext hrContext = TestFixtures.toolContext(
            UserContext.builder().role("user").department("hr").timezone("UTC").build());

    @BeforeEach
    void setUp() {
        llm = new ScriptedLLMProvider();
        registry = new CapabilityRegistry(List.of(new CalculatorTool(), new LateMinutesTool()));
        ParameterResolver resolver = new ParameterResolver(TestFixtures.factory(llm), TestFixtures.promptLibrary(),
                TestFixtures.objectMapper());
        OrchestratorConfig config = new OrchestratorConfig();
        config.getParameters().setMaxRetries(2);
        GlobalRetryConfig retry = new GlobalRetryConfig();
        retry.setBackoffMs(0);
        invoker = new ToolInvoker(registry, resolver, config, retry);
    }

    @Test
    @DisplayName("A string where an array is required is repaired on the next attempt")
    void invoke_repairsScalarUsers() {
        // Given: the first extraction returns users as a plain string
        llm.on(EXTRACTOR,
                "{\"users\": \"alice\", \"time_period\": \"week\"}",
                "{\"users\": [\"alice\"], \"time_period\": \"week\"}");

        // When
        ToolInvocation invocation = invoker.invoke("late_minutes", "How late was alice this week?",
                Map.of(), hrContext);

        // Then
        assertThat(invocation.success()).isTrue();
        assertThat(invocation.attempts()).isEqualTo(2);
        assertThat(invocation.params().getStringList("users")).containsExactly("alice");
        assertThat(invocation.content()).contains("- alice:");

        List<String> prompts = llm.promptsFor(EXTRACTOR);
        assertThat(prompts).hasSize(2);
        assertThat(prompts.get(0)).doesNotContain("RETRY");
        assertThat(prompts.get(1)).contains("RETRY 1")
                .contains("Fix these fields: users")
                .contains("'users' must be an array");
    }

    @Test
    @DisplayName("Retries stop after the configured budget")
    void invoke_givesUpAfterMaxRetries() {
        // Given
        llm.on(EXTRACTOR, "{\"time_period\": \"week\"}");

        // When
        ToolInvocation invocation = invoker.invoke("late_minutes", "How late?", Map.of(), hrContext);

        // Then
        assertThat(invocation.success()).isFalse();
        assertThat(invocation.attempts()).isEqualTo(3);
        assertThat(invocation.error()).contains("users");
        assertThat(llm.callCount(EXTRACTOR)).isEqualTo(3);
    }

    @Test
    @DisplayName("Tool argument errors feed the next extraction")
    void invoke_retriesOnRetryableToolError() {
        // Given: valid by schema, but the tool cannot evaluate it
        llm.on(EXTRACTOR, "{\"expression\": \"two plus two\"}", "{\"expression\": \"2+2\"}");

        // When
        ToolInvocation invocation = invoker.invoke("calculator", "What is two plus two?", Map.of(),
                TestFixtures.toolContext());

        // Then
        assertThat(invocation.success()).isTrue();
        assertThat(invocation.content()).isEqualTo("4");
        assertThat(llm.promptsFor(EXTRACTOR).get(1)).contains("Cannot evaluate 'two plus two'");
    }

    @Test
    @DisplayName("Non-retryable tool failures are reported at once")
    void invoke_doesNotRetryHardFailures() {
        // Given
        AtomicInteger executions = new AtomicInteger();
        registry.register(new BrokenTool(executions));
        llm.on(EXTRACTOR, "{\"id\": \"42\"}");

        // When
        ToolInvocation invocation = invoker.invoke("broken", "lookup 42", Map.of(), TestFixtures.toolContext());

        // Then
        assertThat(invocation.success()).isFalse();
        assertThat(invocation.attempts()).isEqualTo(1);
        assertThat(invocation.error()).isEqualTo("backend down");
        assertThat(executions).hasValue(1);
    }

    @Test
    @DisplayName("Unknown tools fail without calling the model")
    void invoke_unknownTool() {
        ToolInvocation invocation = invoker.invoke("weather", "rain?", Map.of(), TestFixtures.toolContext());

        assertThat(invocation.success()).isFalse();
        assertThat(invocation.error()).isEqualTo("Unknown capability: weather");
        assertThat(llm.callCount(EXTRACTOR)).isZero();
    }

    private static final class BrokenTool implements Tool {

        private final AtomicInteger executions;

        private BrokenTool(AtomicInteger executions) {
            this.executions = executions;
        }

        @Override
        public String getName() {
            return "broken";
        }

        @Override
        public String getDescription() {
            return "Always fails";
        }

        @Override
        public ToolSchema getSchema() {
            return ToolSchema.builder("broken")
                    .description("Always fails")
                    .category(ToolCategory.GENERAL)
                    .version("1")
                    .required(ParameterSpec.builder().name("id").type(ParameterType.STRING).build())
                    .build();
        }

        @Override
        public ToolResult execute(ParsedParameters parameters, ToolContext context) {
            executions.incrementAndGet();
            return ToolResult.failure("backend down");
        }

        @Override
        public ToolCategory getCategory() {
            return ToolCategory.GENERAL;
        }
    }
}
