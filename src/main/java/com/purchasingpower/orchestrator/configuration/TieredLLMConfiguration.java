package com.purchasingpower.orchestrator.configuration;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.chat.StreamingChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.ollama.OllamaStreamingChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Tiered local model configuration.
 *
 * STRATEGY:
 * - TIER 1 (deterministic, temperature 0): agent selection, semantic reflection, parameter extraction
 * - TIER 2 (response model): specialist phrasing, synthesis, final answer, follow-ups
 *
 * Both tiers talk to the same Ollama server; only sampling differs. The Gemini provider
 * is configured separately and takes over tier 2 in hybrid mode.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class TieredLLMConfiguration {

    private final AppProperties appProperties;

    /**
     * TIER 1: routing and extraction. Output must be JSON that parses the same way every time,
     * so sampling is disabled.
     */
    @Bean("toolSelectionModel")
    public ChatLanguageModel toolSelectionModel() {
        OllamaProperties ollama = appProperties.getOllama();
        log.info("🔧 Initializing Tool Selection Model (Ollama - Local)");
        log.info("   - URL: {}", ollama.getBaseUrl());
        log.info("   - Model: {}", ollama.getChatModel());

        return OllamaChatModel.builder()
                .baseUrl(ollama.getBaseUrl())
                .modelName(ollama.getChatModel())
                .timeout(Duration.ofSeconds(ollama.getTimeoutSeconds()))
                .temperature(0.0)
                .maxRetries(ollama.getMaxRetries())
                .logRequests(ollama.isLogRequests())
                .logResponses(ollama.isLogRequests())
                .build();
    }

    /**
     * TIER 2: user-facing text.
     */
    @Bean("responseModel")
    public ChatLanguageModel responseModel() {
        OllamaProperties ollama = appProperties.getOllama();
        log.info("🔧 Initializing Response Model (Ollama - Local, temperature={})", ollama.getResponseTemperature());

        return OllamaChatModel.builder()
                .baseUrl(ollama.getBaseUrl())
                .modelName(ollama.getChatModel())
                .timeout(Duration.ofSeconds(ollama.getTimeoutSeconds()))
                .temperature(ollama.getResponseTemperature())
                .maxRetries(ollama.getMaxRetries())
                .logRequests(ollama.isLogRequests())
                .logResponses(ollama.isLogRequests())
                .build();
    }

    @Bean("streamingResponseModel")
    public StreamingChatLanguageModel streamingResponseModel() {
        OllamaProperties ollama = appProperties.getOllama();
        return OllamaStreamingChatModel.builder()
                .baseUrl(ollama.getBaseUrl())
                .modelName(ollama.getChatModel())
                .timeout(Duration.ofSeconds(ollama.getTimeoutSeconds()))
                .temperature(ollama.getResponseTemperature())
                .logRequests(ollama.isLogRequests())
                .logResponses(ollama.isLogRequests())
                .build();
    }
}
