package com.purchasingpower.orchestrator.tools;

import com.purchasingpower.orchestrator.registry.ParsedParameters;
import com.purchasingpower.orchestrator.registry.ToolResult;
import com.purchasingpower.orchestrator.support.ScriptedLLMProvider;
import com.purchasingpower.orchestrator.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Text Summary Tool Tests")
class TextSummaryToolTest {

    private static final String PASSAGE = "The quarterly report shows revenue grew twelve percent while costs "
            + "stayed flat. Hiring slowed in the second half of the quarter.";

    private final ScriptedLLMProvider provider = new ScriptedLLMProvider();
    private final TextSummaryTool tool = new TextSummaryTool(TestFixtures.factory(provider),
            TestFixtures.promptLibrary());

    @Test
    @DisplayName("Passage is summarized within the requested sentence budget")
    void execute_summarizes() {
        // Given
        provider.on("text-summary", "  Revenue grew 12% with flat costs.  ");

        // When
        ToolResult result = tool.execute(ParsedParameters.of(TextSummaryTool.NAME,
                Map.of("text", PASSAGE, "max_sentences", 1L)), TestFixtures.toolContext());

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getContent()).isEqualTo("Revenue grew 12% with flat costs.");
        assertThat(provider.promptsFor("text-summary").get(0)).contains(PASSAGE).contains("1");
    }

    @Test
    @DisplayName("Missing passage is an argument problem")
    void execute_rejectsShortText() {
        ToolResult result = tool.execute(ParsedParameters.of(TextSummaryTool.NAME, Map.of("text", "summarize")),
                TestFixtures.toolContext());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isRetryable()).isTrue();
        assertThat(provider.callCount("text-summary")).isZero();
    }

    @Test
    @DisplayName("Model failure is a non-retryable tool failure")
    void execute_modelUnavailable() {
        provider.failOn("text-summary");

        ToolResult result = tool.execute(ParsedParameters.of(TextSummaryTool.NAME, Map.of("text", PASSAGE)),
                TestFixtures.toolContext());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isRetryable()).isFalse();
        assertThat(result.getError()).isEqualTo("Summary model unavailable");
    }
}
