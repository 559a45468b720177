package com.purchasingpower.orchestrator.service;

import com.purchasingpower.orchestrator.model.dto.EndPayload;
import com.purchasingpower.orchestrator.model.dto.WorkflowEvent;
import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;

/**
 * What a caller gets back from {@link OrchestrationService#submit}: the request id, the
 * event stream (replayed from the first event for late subscribers) and the END payload.
 */
public record RequestHandle(String requestId, Flux<WorkflowEvent> events, CompletableFuture<EndPayload> completion) {
}
