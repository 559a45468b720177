package com.purchasingpower.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.orchestrator.client.LLMCallOptions;
import com.purchasingpower.orchestrator.model.prompt.PromptTemplate;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt Library Service
 *
 * Loads prompts from YAML files once at startup, compiles each with Mustache and renders
 * them with variables.
 *
 * Usage:
 * String prompt = promptLibrary.render("agent-selector", Map.of(
 *     "query", "How many leave days do I have?",
 *     "domains", domainList
 * ));
 */
@Slf4j
@Service
public class PromptLibraryService {

    private static final String PROMPT_LOCATION = "classpath:prompts/*.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver().getResources(PROMPT_LOCATION);
            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    register(yamlMapper.readValue(in, PromptTemplate.class));
                }
            }
            log.info("Loaded {} prompt templates", templates.size());
        } catch (IOException e) {
            log.error("Failed to load prompt templates", e);
            throw new IllegalStateException("Prompt library initialization failed", e);
        }
    }

    /**
     * Adds or replaces a template. Compilation happens here, not on every render.
     */
    public void register(PromptTemplate template) {
        String fullPrompt = template.getSystemPrompt() + "\n\n" + template.getUserPrompt();
        compiled.put(template.getName(),
                mustacheFactory.compile(new StringReader(fullPrompt), template.getName()));
        templates.put(template.getName(), template);
        log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
    }

    /**
     * Render a prompt with variables.
     */
    public String render(String templateName, Map<String, Object> variables) {
        Mustache mustache = compiled.get(templateName);
        if (mustache == null) {
            throw new IllegalArgumentException("Prompt template not found: " + templateName);
        }
        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString();
    }

    /**
     * Call options derived from the template's sampling metadata.
     */
    public LLMCallOptions optionsFor(String templateName, String requestId) {
        PromptTemplate template = templates.get(templateName);
        if (template == null) {
            throw new IllegalArgumentException("Prompt template not found: " + templateName);
        }
        return LLMCallOptions.builder()
                .purpose(templateName)
                .requestId(requestId)
                .temperature(template.getTemperature())
                .jsonOutput(template.isJsonOutput())
                .deterministic(template.isDeterministic())
                .build();
    }

    public PromptTemplate getTemplate(String name) {
        return templates.get(name);
    }
}
