package com.purchasingpower.orchestrator.tools;

import com.purchasingpower.orchestrator.registry.ParameterSpec;
import com.purchasingpower.orchestrator.registry.ParameterType;
import com.purchasingpower.orchestrator.registry.ParsedParameters;
import com.purchasingpower.orchestrator.registry.Tool;
import com.purchasingpower.orchestrator.registry.ToolContext;
import com.purchasingpower.orchestrator.registry.ToolResult;
import com.purchasingpower.orchestrator.registry.ToolSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Map;

/**
 * Evaluates arithmetic expressions such as {@code (12.5 * 4) / 2} or {@code sqrt(16) + 2^3}.
 */
@Slf4j
@Component
public class CalculatorTool implements Tool {

    public static final String NAME = "calculator";

    private static final ToolSchema SCHEMA = ToolSchema.builder(NAME)
            .description("Evaluates a mathematical expression with + - * / % ^, parentheses and "
                    + "functions sqrt, abs, round, floor, ceil, ln, log, sin, cos, tan, pow, min, max.")
            .category(ToolCategory.CALCULATION)
            .version("1.1")
            .required(ParameterSpec.builder()
                    .name("expression")
                    .type(ParameterType.STRING)
                    .description("The arithmetic expression only, e.g. \"(3 + 5) * 2\"; no words or units")
                    .build())
            .optional(ParameterSpec.builder()
                    .name("precision")
                    .type(ParameterType.INTEGER)
                    .description("Significant digits of the result")
                    .defaultValue(10L)
                    .build())
            .build();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return SCHEMA.getDescription();
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.CALCULATION;
    }

    @Override
    public ToolResult execute(ParsedParameters parameters, ToolContext context) {
        String expression = parameters.getString("expression").orElse("");
        int precision = (int) Math.max(1, Math.min(30, parameters.getLong("precision").orElse(10L)));
        try {
            double value = ExpressionEvaluator.evaluate(expression);
            String formatted = format(value, precision);
            log.debug("🧮 {} = {}", expression, formatted);
            return ToolResult.success(formatted,
                    Map.of("expression", expression, "result", formatted),
                    List.of("tool:" + NAME));
        } catch (IllegalArgumentException e) {
            log.warn("Calculator rejected '{}': {}", expression, e.getMessage());
            return ToolResult.invalidArguments("Cannot evaluate '" + expression + "': " + e.getMessage());
        }
    }

    static String format(double value, int precision) {
        BigDecimal decimal = new BigDecimal(value).round(new MathContext(precision)).stripTrailingZeros();
        if (decimal.scale() < 0) {
            decimal = decimal.setScale(0);
        }
        return decimal.toPlainString();
    }
}
