package com.purchasingpower.orchestrator.resolver;

import com.purchasingpower.orchestrator.registry.Tool.ToolCategory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Category specific hints appended to the parameter extraction prompt.
 */
final class ExtractionInstructions {

    private static final List<String> COMMON = List.of(
            "Return only parameters declared in the schema.",
            "Array parameters are always JSON arrays, even with a single element.",
            "Omit optional parameters the query does not mention instead of inventing values.");

    private static final Map<ToolCategory, List<String>> BY_CATEGORY = new EnumMap<>(ToolCategory.class);

    static {
        BY_CATEGORY.put(ToolCategory.CALCULATION, List.of(
                "Extract the mathematical expression from natural language.",
                "Convert number words to digits and operator words to symbols (plus +, minus -, times *, divided by /).",
                "Preserve operators and parentheses; drop units and surrounding words."));
        BY_CATEGORY.put(ToolCategory.DATETIME, List.of(
                "Questions about the time use current_time; about the date use current_date.",
                "tomorrow: add_time with amount 1, unit days. yesterday: subtract_time with amount 1, unit days.",
                "next week / last week: add_time / subtract_time with amount 1, unit weeks; same pattern for months and years.",
                "For relative expressions do not set datetime; the current time in the user's timezone is used.",
                "Leave timezone unset unless the query names a place or zone."));
        BY_CATEGORY.put(ToolCategory.ATTENDANCE, List.of(
                "users is a JSON array of the people named in the query, e.g. [\"alice\"].",
                "Map today to day, this week to week, this month to month, this year to year.",
                "Times are HH:mm in 24-hour form."));
        BY_CATEGORY.put(ToolCategory.SUMMARY, List.of(
                "Copy the text to summarize verbatim.",
                "Only set a length limit when the query asks for one."));
        BY_CATEGORY.put(ToolCategory.SEARCH, List.of(
                "Extract the main search terms and keywords.",
                "Keep filters or constraints the query mentions."));
    }

    private ExtractionInstructions() {
    }

    static List<String> forCategory(ToolCategory category) {
        List<String> instructions = new ArrayList<>(BY_CATEGORY.getOrDefault(category,
                List.of("Extract the parameters that match the tool's purpose and the user's intent.")));
        instructions.addAll(COMMON);
        return instructions;
    }
}
