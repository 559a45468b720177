package com.purchasingpower.orchestrator.client;

import com.purchasingpower.orchestrator.configuration.AppProperties;
import com.purchasingpower.orchestrator.exception.LLMProviderException;
import com.purchasingpower.orchestrator.model.CallContext;
import com.purchasingpower.orchestrator.model.ServiceType;
import com.purchasingpower.orchestrator.util.ExternalCallLogger;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.StreamingResponseHandler;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.chat.StreamingChatLanguageModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

/**
 * Ollama provider backed by the langchain4j models of the tiered configuration.
 *
 * Deterministic calls go to the tool selection model, everything else to the
 * response model. Streaming uses the streaming response model.
 */
@Slf4j
@Component
public class OllamaProvider implements LLMProvider {

    private final ChatLanguageModel toolSelectionModel;
    private final ChatLanguageModel responseModel;
    private final StreamingChatLanguageModel streamingResponseModel;
    private final AppProperties appProperties;

    public OllamaProvider(
            @Qualifier("toolSelectionModel") ChatLanguageModel toolSelectionModel,
            @Qualifier("responseModel") ChatLanguageModel responseModel,
            @Qualifier("streamingResponseModel") StreamingChatLanguageModel streamingResponseModel,
            AppProperties appProperties) {
        this.toolSelectionModel = toolSelectionModel;
        this.responseModel = responseModel;
        this.streamingResponseModel = streamingResponseModel;
        this.appProperties = appProperties;
    }

    @Override
    public String chat(String prompt, LLMCallOptions options) {
        ChatLanguageModel model = options.isDeterministic() ? toolSelectionModel : responseModel;
        CallContext call = ExternalCallLogger.startCall(
                ServiceType.OLLAMA, "chat", options.getRequestId(), log);
        call.logRequest(
                "Purpose", options.getPurpose(),
                "Tier", options.isDeterministic() ? "tool-selection" : "response",
                "Prompt", ExternalCallLogger.truncate(prompt, 300));

        try {
            String content = model.generate(prompt);
            call.logResponse("Length", content == null ? 0 : content.length(),
                    "Content", ExternalCallLogger.truncate(content, 300));
            return content == null ? "" : content;
        } catch (RuntimeException e) {
            call.logError(e.getMessage(), e);
            throw new LLMProviderException(getProviderName(), options.getPurpose(),
                    "Ollama call failed for " + options.getPurpose(), e);
        }
    }

    @Override
    public Flux<String> stream(String prompt, LLMCallOptions options) {
        return Flux.create(sink -> {
            CallContext call = ExternalCallLogger.startCall(
                    ServiceType.OLLAMA, "stream", options.getRequestId(), log);
            call.logRequest("Purpose", options.getPurpose(),
                    "Prompt", ExternalCallLogger.truncate(prompt, 300));
            try {
                streamingResponseModel.generate(prompt, new SinkHandler(sink, call, options));
            } catch (RuntimeException e) {
                call.logError(e.getMessage(), e);
                sink.error(new LLMProviderException(getProviderName(), options.getPurpose(),
                        "Ollama stream could not be started", e));
            }
        });
    }

    @Override
    public String getProviderKey() {
        return "ollama";
    }

    @Override
    public String getProviderName() {
        return "Ollama (" + appProperties.getOllama().getChatModel() + ")";
    }

    private final class SinkHandler implements StreamingResponseHandler<AiMessage> {

        private final FluxSink<String> sink;
        private final CallContext call;
        private final LLMCallOptions options;

        private SinkHandler(FluxSink<String> sink, CallContext call, LLMCallOptions options) {
            this.sink = sink;
            this.call = call;
            this.options = options;
        }

        @Override
        public void onNext(String token) {
            if (token != null && !token.isEmpty()) {
                sink.next(token);
            }
        }

        @Override
        public void onComplete(Response<AiMessage> response) {
            call.logResponse("Purpose", options.getPurpose());
            sink.complete();
        }

        @Override
        public void onError(Throwable error) {
            call.logError(error.getMessage(), error);
            sink.error(new LLMProviderException(getProviderName(), options.getPurpose(),
                    "Ollama stream failed for " + options.getPurpose(), error));
        }
    }
}
