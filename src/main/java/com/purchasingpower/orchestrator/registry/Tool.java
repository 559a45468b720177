package com.purchasingpower.orchestrator.registry;

/**
 * An external capability a domain specialist can invoke.
 *
 * <p>Each tool publishes a typed {@link ToolSchema}. Parameters reach
 * {@link #execute} only after they satisfied that schema, so implementations can
 * rely on every required parameter being present with its declared type.
 *
 * <p>Example implementation:
 * <pre>
 * public class CalculatorTool implements Tool {
 *     public String getName() { return "calculator"; }
 *
 *     public ToolResult execute(ParsedParameters params, ToolContext context) {
 *         String expression = params.getString("expression");
 *         // evaluate and return
 *     }
 * }
 * </pre>
 */
public interface Tool {

    /**
     * Unique name (e.g. "calculator", "late_minutes"). Domains list tools by this name.
     */
    String getName();

    /**
     * Human-readable description for the model.
     */
    String getDescription();

    /**
     * Typed parameter schema used for extraction and validation.
     */
    ToolSchema getSchema();

    /**
     * Execute this tool.
     *
     * @param parameters schema-valid parameters
     * @param context caller identity, timezone and request id
     * @return result; argument problems should come back as {@link ToolResult#invalidArguments}
     *         so the caller can repair the parameters and retry
     */
    ToolResult execute(ParsedParameters parameters, ToolContext context);

    /**
     * Category of this tool. Drives category-specific extraction instructions.
     */
    ToolCategory getCategory();

    enum ToolCategory {
        CALCULATION,
        DATETIME,
        ATTENDANCE,
        SUMMARY,
        SEARCH,
        GENERAL
    }
}
