package com.purchasingpower.orchestrator.client;

import reactor.core.publisher.Flux;

/**
 * Unified interface for language-model backends (Ollama, Gemini).
 *
 * Both operations may fail with {@link com.purchasingpower.orchestrator.exception.LLMProviderException};
 * callers treat that as a failure of their own phase, never as fatal.
 */
public interface LLMProvider {

    /**
     * Send a prompt and wait for the whole completion.
     *
     * @param prompt rendered prompt
     * @param options purpose, temperature and timeout of this call
     * @return completion text
     */
    String chat(String prompt, LLMCallOptions options);

    /**
     * Send a prompt and receive the completion as text fragments, in order.
     * Nothing is sent to the backend until the flux is subscribed.
     */
    Flux<String> stream(String prompt, LLMCallOptions options);

    /**
     * Routing key used by {@link LLMProviderFactory}: "ollama" or "gemini".
     */
    String getProviderKey();

    /**
     * Human readable name for logs.
     */
    String getProviderName();
}
