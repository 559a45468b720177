package com.purchasingpower.orchestrator.tools;

import com.purchasingpower.orchestrator.registry.ParsedParameters;
import com.purchasingpower.orchestrator.registry.ToolResult;
import com.purchasingpower.orchestrator.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Calculator Tool Tests")
class CalculatorToolTest {

    private final CalculatorTool tool = new CalculatorTool();

    @ParameterizedTest(name = "{0} = {1}")
    @CsvSource(delimiter = '|', value = {
            "2+2|4",
            "(12.5 * 4) / 2|25",
            "2^3 + sqrt(16)|12",
            "-3 + 10 % 4|-1",
            "max(1, 7, 3)|7",
            "10 / 4|2.5",
            "-2^2|-4",
            "(-2)^2|4",
            "2^3^2|512",
            "2^-1|0.5"
    })
    @DisplayName("Should evaluate arithmetic expressions")
    void execute_evaluatesExpression(String expression, String expected) {
        // When
        ToolResult result = run(expression);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getContent()).isEqualTo(expected);
        assertThat(result.getEvidence()).containsExactly("tool:calculator");
    }

    @Test
    @DisplayName("Words in the expression are an argument problem worth retrying")
    void execute_rejectsProse() {
        // When
        ToolResult result = run("two plus two");

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isRetryable()).isTrue();
        assertThat(result.getError()).contains("two plus two");
    }

    @Test
    @DisplayName("Division by zero has no finite result")
    void execute_rejectsDivisionByZero() {
        ToolResult result = run("1/0");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("finite");
    }

    @Test
    @DisplayName("Precision limits significant digits")
    void execute_honorsPrecision() {
        ToolResult result = tool.execute(
                ParsedParameters.of("calculator", Map.of("expression", "1/3", "precision", 3L)),
                TestFixtures.toolContext());

        assertThat(result.getContent()).isEqualTo("0.333");
    }

    private ToolResult run(String expression) {
        return tool.execute(ParsedParameters.of("calculator", Map.of("expression", expression, "precision", 10L)),
                TestFixtures.toolContext());
    }
}
