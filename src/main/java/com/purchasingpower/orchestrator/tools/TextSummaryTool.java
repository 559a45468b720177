package com.purchasingpower.orchestrator.tools;

import com.purchasingpower.orchestrator.client.LLMProviderFactory;
import com.purchasingpower.orchestrator.exception.LLMProviderException;
import com.purchasingpower.orchestrator.registry.ParameterSpec;
import com.purchasingpower.orchestrator.registry.ParameterType;
import com.purchasingpower.orchestrator.registry.ParsedParameters;
import com.purchasingpower.orchestrator.registry.Tool;
import com.purchasingpower.orchestrator.registry.ToolContext;
import com.purchasingpower.orchestrator.registry.ToolResult;
import com.purchasingpower.orchestrator.registry.ToolSchema;
import com.purchasingpower.orchestrator.service.PromptLibraryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Summarizes a block of text supplied in the query.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TextSummaryTool implements Tool {

    public static final String NAME = "text_summary";

    private static final ToolSchema SCHEMA = ToolSchema.builder(NAME)
            .description("Summarizes a block of text the user pasted or quoted.")
            .category(ToolCategory.SUMMARY)
            .version("1.0")
            .required(ParameterSpec.builder()
                    .name("text")
                    .type(ParameterType.STRING)
                    .description("The exact text to summarize, copied from the query")
                    .build())
            .optional(ParameterSpec.builder()
                    .name("max_sentences")
                    .type(ParameterType.INTEGER)
                    .description("Upper bound on summary length")
                    .defaultValue(3L)
                    .build())
            .build();

    private final LLMProviderFactory providerFactory;
    private final PromptLibraryService promptLibrary;

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
        return ToolCategory.SUMMARY;
    }

    @Override
    public ToolResult execute(ParsedParameters parameters, ToolContext context) {
        String text = parameters.getString("text").orElse("");
        if (text.length() < 20) {
            return ToolResult.invalidArguments("text must contain the passage to summarize, got: '" + text + "'");
        }
        long maxSentences = parameters.getLong("max_sentences").orElse(3L);
        String prompt = promptLibrary.render("text-summary", Map.of(
                "text", text,
                "maxSentences", maxSentences));
        try {
            String summary = providerFactory.getFinalResponseProvider()
                    .chat(prompt, promptLibrary.optionsFor("text-summary", context.getRequestId()));
            return ToolResult.success(summary.trim(), Map.of("max_sentences", maxSentences),
                    List.of("tool:" + NAME));
        } catch (LLMProviderException e) {
            log.warn("Summary generation failed: {}", e.getMessage());
            return ToolResult.failure("Summary model unavailable");
        }
    }
}
