package com.purchasingpower.orchestrator.support;

import com.purchasingpower.orchestrator.client.LLMProviderFactory;
import com.purchasingpower.orchestrator.configuration.AppProperties;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.util.List;

/**
 * Routes every model call of a Spring test context to one {@link ScriptedLLMProvider}.
 */
@TestConfiguration
public class ScriptedLLMConfig {

    @Bean
    public ScriptedLLMProvider scriptedLLMProvider() {
        return new ScriptedLLMProvider();
    }

    @Bean
    @Primary
    public LLMProviderFactory scriptedProviderFactory(ScriptedLLMProvider scriptedLLMProvider,
                                                      AppProperties appProperties) {
        return new LLMProviderFactory(List.of(scriptedLLMProvider), appProperties);
    }
}
