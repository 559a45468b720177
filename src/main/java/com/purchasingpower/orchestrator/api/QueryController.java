package com.purchasingpower.orchestrator.api;

import com.purchasingpower.orchestrator.config.OrchestratorConfig;
import com.purchasingpower.orchestrator.model.dto.EndPayload;
import com.purchasingpower.orchestrator.model.dto.QueryRequest;
import com.purchasingpower.orchestrator.model.dto.QueryResponse;
import com.purchasingpower.orchestrator.registry.CapabilityRegistry;
import com.purchasingpower.orchestrator.registry.RegisteredCapability;
import com.purchasingpower.orchestrator.registry.ToolSchema;
import com.purchasingpower.orchestrator.service.OrchestrationService;
import com.purchasingpower.orchestrator.service.RequestHandle;
import com.purchasingpower.orchestrator.service.WorkflowStreamService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * REST controller for running queries.
 *
 * POST /api/v1/query/stream - SSE stream of workflow events
 * POST /api/v1/query        - blocking, returns the END payload
 * DELETE /api/v1/query/{id} - cancel an in-flight request
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class QueryController {

    private final OrchestrationService orchestrationService;
    private final WorkflowStreamService streamService;
    private final CapabilityRegistry capabilityRegistry;
    private final OrchestratorConfig config;

    @PostMapping(value = "/query/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@Valid @RequestBody QueryRequest request) {
        RequestHandle handle = orchestrationService.submit(request);
        return streamService.stream(handle);
    }

    @PostMapping("/query")
    public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request)
            throws InterruptedException, ExecutionException {
        RequestHandle handle = orchestrationService.submit(request);
        Duration wait = config.getTimeouts().total();
        try {
            EndPayload end = handle.completion().get(wait.toMillis(), TimeUnit.MILLISECONDS);
            HttpStatus status = end.isCompleted() ? HttpStatus.OK : HttpStatus.BAD_GATEWAY;
            return ResponseEntity.status(status).body(QueryResponse.builder()
                    .requestId(handle.requestId())
                    .result(end)
                    .build());
        } catch (TimeoutException e) {
            log.warn("⏱️ Blocking query {} exceeded {}", handle.requestId(), wait);
            orchestrationService.cancel(handle.requestId());
            EndPayload end = handle.completion().getNow(null);
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(QueryResponse.builder()
                    .requestId(handle.requestId())
                    .result(end)
                    .build());
        } catch (InterruptedException e) {
            orchestrationService.cancel(handle.requestId());
            throw e;
        }
    }

    @DeleteMapping("/query/{requestId}")
    public ResponseEntity<Void> cancel(@PathVariable String requestId) {
        if (orchestrationService.cancel(requestId)) {
            log.info("🛑 Cancel accepted for {}", requestId);
            return ResponseEntity.accepted().build();
        }
        return ResponseEntity.notFound().build();
    }

    @GetMapping("/capabilities")
    public List<CapabilityView> capabilities() {
        return capabilityRegistry.list().stream()
                .sorted(Comparator.comparing(RegisteredCapability::name))
                .map(capability -> new CapabilityView(capability.schema(), capability.revision()))
                .toList();
    }

    @GetMapping("/query/health")
    public HealthResponse health() {
        return new HealthResponse("UP", orchestrationService.activeCount(), capabilityRegistry.names().size());
    }

    public record CapabilityView(ToolSchema schema, long revision) {}

    public record HealthResponse(String status, int activeRequests, int capabilities) {}
}
