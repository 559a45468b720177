package com.purchasingpower.orchestrator.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.purchasingpower.orchestrator.client.LLMProviderFactory;
import com.purchasingpower.orchestrator.configuration.AppProperties;
import com.purchasingpower.orchestrator.model.UserContext;
import com.purchasingpower.orchestrator.registry.ToolContext;
import com.purchasingpower.orchestrator.service.LocalizedMessageService;
import com.purchasingpower.orchestrator.service.PromptLibraryService;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Plain-object wiring for unit tests that do not need a Spring context.
 */
public final class TestFixtures {

    /**
     * Wednesday 2025-01-15 10:30 UTC.
     */
    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2025-01-15T10:30:00Z"), ZoneOffset.UTC);

    private TestFixtures() {
    }

    public static PromptLibraryService promptLibrary() {
        PromptLibraryService library = new PromptLibraryService();
        library.loadPrompts();
        return library;
    }

    public static LocalizedMessageService messages() {
        LocalizedMessageService messages = new LocalizedMessageService();
        messages.loadMessages();
        return messages;
    }

    public static LLMProviderFactory factory(ScriptedLLMProvider provider) {
        AppProperties properties = new AppProperties();
        properties.setLlmProvider("ollama");
        return new LLMProviderFactory(List.of(provider), properties);
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper().registerModule(new JavaTimeModule());
    }

    public static ToolContext toolContext(UserContext user) {
        return ToolContext.of("req-test", "test query", user, FIXED_CLOCK);
    }

    public static ToolContext toolContext() {
        return toolContext(UserContext.anonymous());
    }
}
