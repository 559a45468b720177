package com.purchasingpower.orchestrator.client;

import com.purchasingpower.orchestrator.configuration.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Picks the provider for each kind of call.
 *
 * <ul>
 *   <li>ollama - everything local</li>
 *   <li>gemini - everything in the cloud</li>
 *   <li>hybrid - local model for selection, reflection and extraction; Gemini for user-facing text</li>
 * </ul>
 */
@Slf4j
@Component
public class LLMProviderFactory {

    private final Map<String, LLMProvider> providers = new LinkedHashMap<>();
    private final String mode;

    public LLMProviderFactory(List<LLMProvider> available, AppProperties appProperties) {
        for (LLMProvider provider : available) {
            providers.put(provider.getProviderKey().toLowerCase(Locale.ROOT), provider);
        }
        this.mode = appProperties.getLlmProvider() == null
                ? "ollama"
                : appProperties.getLlmProvider().toLowerCase(Locale.ROOT);
        log.info("🚀 LLM provider mode: {} (available: {})", mode, providers.keySet());
    }

    /**
     * Provider for the configured mode.
     */
    public LLMProvider getProvider() {
        if ("hybrid".equals(mode)) {
            return byKey("gemini");
        }
        return byKey(mode);
    }

    /**
     * Agent selection, semantic reflection, parameter extraction.
     */
    public LLMProvider getToolSelectionProvider() {
        if ("hybrid".equals(mode)) {
            return byKey("ollama");
        }
        return getProvider();
    }

    /**
     * Specialist answers, synthesis, final phrasing, follow-ups.
     */
    public LLMProvider getFinalResponseProvider() {
        return getProvider();
    }

    private LLMProvider byKey(String key) {
        LLMProvider provider = providers.get(key);
        if (provider != null) {
            return provider;
        }
        if (providers.isEmpty()) {
            throw new IllegalStateException("No LLM provider registered");
        }
        LLMProvider fallback = providers.values().iterator().next();
        log.warn("Unknown LLM provider: {}, falling back to {}", key, fallback.getProviderName());
        return fallback;
    }
}
