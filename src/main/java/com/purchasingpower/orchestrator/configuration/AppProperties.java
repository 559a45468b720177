package com.purchasingpower.orchestrator.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    /**
     * ollama, gemini, or hybrid (local model for routing and extraction, Gemini for answers).
     */
    @Pattern(regexp = "(?i)ollama|gemini|hybrid", message = "app.llm-provider must be ollama, gemini or hybrid")
    private String llmProvider = "ollama";

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private OllamaProperties ollama = new OllamaProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GeminiProperties gemini = new GeminiProperties();
}
