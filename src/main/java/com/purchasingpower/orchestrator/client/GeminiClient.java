package com.purchasingpower.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.orchestrator.config.GlobalRetryConfig;
import com.purchasingpower.orchestrator.config.OrchestratorConfig;
import com.purchasingpower.orchestrator.configuration.AppProperties;
import com.purchasingpower.orchestrator.configuration.GeminiProperties;
import com.purchasingpower.orchestrator.exception.LLMProviderException;
import com.purchasingpower.orchestrator.model.CallContext;
import com.purchasingpower.orchestrator.model.ServiceType;
import com.purchasingpower.orchestrator.util.ExternalCallLogger;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Gemini provider over the REST API.
 *
 * Blocking calls use {@code generateContent} with a configurable retry on transient HTTP
 * statuses; streaming uses {@code streamGenerateContent?alt=sse} and is never retried
 * since fragments may already have been handed to the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeminiClient implements LLMProvider {

    private final AppProperties props;
    private final GlobalRetryConfig retryConfig;
    private final OrchestratorConfig orchestratorConfig;
    private final ObjectMapper objectMapper;

    private WebClient geminiWebClient;

    @PostConstruct
    public void init() {
        GeminiProperties gemini = props.getGemini();
        if (gemini.getApiKey() == null || gemini.getApiKey().isBlank()) {
            log.warn("⚠️ Gemini API key not configured; gemini and hybrid providers will fail");
        }
        // API key travels in a header so it never shows up in access logs
        this.geminiWebClient = WebClient.builder()
                .baseUrl(gemini.getBaseUrl())
                .defaultHeader("x-goog-api-key", gemini.getApiKey() == null ? "" : gemini.getApiKey())
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build())
                .build();
    }

    @Override
    public String chat(String prompt, LLMCallOptions options) {
        String model = props.getGemini().getChatModel();
        CallContext call = ExternalCallLogger.startCall(ServiceType.GEMINI, "generateContent",
                options.getRequestId(), log);
        call.logRequest(
                "Purpose", options.getPurpose(),
                "Model", model,
                "Prompt", ExternalCallLogger.truncate(prompt, 300));

        try {
            String json = geminiWebClient.post()
                    .uri(apiPath(model, "generateContent"))
                    .bodyValue(requestBody(prompt, options))
                    .retrieve()
                    .bodyToMono(String.class)
                    .retryWhen(buildRetrySpec())
                    .block(timeoutOf(options));

            String text = extractText(objectMapper.readTree(json));
            call.logResponse("Length", text.length(), "Content", ExternalCallLogger.truncate(text, 300));
            return text;

        } catch (WebClientResponseException e) {
            call.logError(e.getStatusCode() + ": " + e.getMessage(), e);
            throw new LLMProviderException(getProviderName(), options.getPurpose(),
                    "Gemini API call failed with status " + e.getStatusCode().value(), e);
        } catch (Exception e) {
            call.logError("Unexpected error", e);
            throw new LLMProviderException(getProviderName(), options.getPurpose(),
                    "Gemini API call failed for " + options.getPurpose(), e);
        }
    }

    @Override
    public Flux<String> stream(String prompt, LLMCallOptions options) {
        String model = props.getGemini().getChatModel();
        return Flux.defer(() -> {
            CallContext call = ExternalCallLogger.startCall(ServiceType.GEMINI, "streamGenerateContent",
                    options.getRequestId(), log);
            call.logRequest("Purpose", options.getPurpose(), "Model", model);

            return geminiWebClient.post()
                    .uri(apiPath(model, "streamGenerateContent") + "?alt=sse")
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(requestBody(prompt, options))
                    .retrieve()
                    .bodyToFlux(String.class)
                    .map(this::extractChunkText)
                    .filter(text -> !text.isEmpty())
                    .doOnComplete(() -> call.logResponse("Purpose", options.getPurpose()))
                    .onErrorMap(e -> !(e instanceof LLMProviderException), e -> {
                        call.logError(e.getMessage(), e);
                        return new LLMProviderException(getProviderName(), options.getPurpose(),
                                "Gemini stream failed for " + options.getPurpose(), e);
                    });
        });
    }

    @Override
    public String getProviderKey() {
        return "gemini";
    }

    @Override
    public String getProviderName() {
        return "Gemini (" + props.getGemini().getChatModel() + ")";
    }

    private String apiPath(String model, String action) {
        return String.format("/%s/models/%s:%s", props.getGemini().getApiVersion(), model, action);
    }

    private Map<String, Object> requestBody(String prompt, LLMCallOptions options) {
        Map<String, Object> generationConfig = new HashMap<>();
        double temperature = options.getTemperature() != null
                ? options.getTemperature()
                : (options.isDeterministic() ? 0.0 : 0.3);
        generationConfig.put("temperature", temperature);
        if (options.isJsonOutput()) {
            generationConfig.put("responseMimeType", "application/json");
        }
        return Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))),
                "generationConfig", generationConfig);
    }

    private Duration timeoutOf(LLMCallOptions options) {
        return options.getTimeout() != null ? options.getTimeout() : orchestratorConfig.getTimeouts().getModelCall();
    }

    /**
     * Exponential backoff limited to the configured retryable statuses.
     */
    private Retry buildRetrySpec() {
        return Retry.backoff(retryConfig.getMaxAttempts(), retryConfig.initialBackoff())
                .maxBackoff(retryConfig.maxBackoff())
                .filter(this::isRetryable);
    }

    private boolean isRetryable(Throwable ex) {
        if (!(ex instanceof WebClientResponseException webEx)) {
            return false;
        }
        List<Integer> codes = retryConfig.getRetryableStatusCodes();
        if (codes == null || codes.isEmpty()) {
            return webEx.getStatusCode().is5xxServerError() || webEx.getStatusCode().value() == 429;
        }
        return codes.contains(webEx.getStatusCode().value());
    }

    private String extractText(JsonNode root) {
        JsonNode parts = root.path("candidates").path(0).path("content").path("parts");
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            text.append(part.path("text").asText(""));
        }
        return text.toString();
    }

    private String extractChunkText(String chunk) {
        try {
            return extractText(objectMapper.readTree(chunk));
        } catch (IOException e) {
            throw new LLMProviderException(getProviderName(), "stream", "Unreadable Gemini stream chunk", e);
        }
    }
}
