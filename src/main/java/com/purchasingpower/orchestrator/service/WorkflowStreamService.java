package com.purchasingpower.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.orchestrator.model.dto.WorkflowEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bridges a request's event stream onto a Server-Sent Events connection.
 *
 * Each event goes out with {@code id = sequence} and {@code event = type name}. A client that
 * goes away (timeout, network error) cancels the request it was watching.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowStreamService {

    /**
     * Timeout for SSE connections (5 minutes).
     */
    private static final long SSE_TIMEOUT_MS = 5 * 60 * 1000;

    private final OrchestrationService orchestrationService;
    private final ObjectMapper objectMapper;

    public SseEmitter stream(RequestHandle handle) {
        String requestId = handle.requestId();
        log.info("📡 Creating SSE stream for request: {}", requestId);

        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
        AtomicReference<Disposable> subscription = new AtomicReference<>();

        emitter.onCompletion(() -> {
            log.info("✅ SSE stream completed for request: {}", requestId);
            dispose(subscription);
        });
        emitter.onTimeout(() -> {
            log.warn("⏱️ SSE stream timed out for request: {}", requestId);
            abandon(requestId, subscription);
            emitter.complete();
        });
        emitter.onError(error -> {
            log.warn("❌ SSE stream error for request {}: {}", requestId, error.getMessage());
            abandon(requestId, subscription);
        });

        subscription.set(handle.events().subscribe(
                event -> send(emitter, event, requestId, subscription),
                error -> {
                    log.error("Event stream failed for request {}", requestId, error);
                    emitter.completeWithError(error);
                },
                emitter::complete));
        return emitter;
    }

    private void send(SseEmitter emitter, WorkflowEvent event, String requestId,
                      AtomicReference<Disposable> subscription) {
        try {
            emitter.send(SseEmitter.event()
                    .id(String.valueOf(event.getSequence()))
                    .name(event.getType().getEventName())
                    .data(objectMapper.writeValueAsString(event), MediaType.APPLICATION_JSON));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event {} of request {}", event.getSequence(), requestId, e);
        } catch (IOException | IllegalStateException e) {
            log.warn("⚠️ Client of request {} disconnected: {}", requestId, e.getMessage());
            abandon(requestId, subscription);
        }
    }

    private void abandon(String requestId, AtomicReference<Disposable> subscription) {
        dispose(subscription);
        if (orchestrationService.cancel(requestId)) {
            log.info("🛑 Request {} cancelled after its client went away", requestId);
        }
    }

    private static void dispose(AtomicReference<Disposable> subscription) {
        Disposable current = subscription.getAndSet(null);
        if (current != null) {
            current.dispose();
        }
    }
}
