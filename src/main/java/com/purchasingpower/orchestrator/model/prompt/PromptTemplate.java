package com.purchasingpower.orchestrator.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from {@code classpath:prompts/*.yaml}.
 *
 * YAML structure:
 * <pre>
 * name: agent-selector
 * version: 1.2
 * temperature: 0.0
 * jsonOutput: true
 * deterministic: true
 * systemPrompt: |
 *   You route user queries to domain specialists...
 * userPrompt: |
 *   Query: {{{query}}}
 * </pre>
 *
 * Variables holding user text or JSON use triple mustaches so they are not HTML-escaped.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private Double temperature;
    private boolean jsonOutput;
    private boolean deterministic;
    private String systemPrompt;
    private String userPrompt;
}
