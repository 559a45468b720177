package com.purchasingpower.orchestrator.workflow.event;

import com.purchasingpower.orchestrator.model.dto.EventType;
import com.purchasingpower.orchestrator.model.dto.WorkflowEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ordered event stream of one request.
 *
 * Sequence numbers are assigned under the emit lock, so they are strictly increasing in
 * publication order. The first END event closes the stream; anything emitted afterwards is
 * dropped. Late subscribers receive the whole history.
 */
@Slf4j
public class WorkflowEventEmitter {

    private final String requestId;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean terminated = new AtomicBoolean();
    private final Sinks.Many<WorkflowEvent> sink = Sinks.many().replay().all();

    public WorkflowEventEmitter(String requestId, Clock clock) {
        this.requestId = requestId;
        this.clock = clock;
    }

    /**
     * Stamps and publishes a draft event.
     *
     * @return false when the stream was already terminated and the event was dropped
     */
    public synchronized boolean emit(WorkflowEvent draft) {
        if (terminated.get()) {
            log.debug("Dropping {} event for {}: stream already terminated", draft.getType(), requestId);
            return false;
        }
        boolean terminal = draft.getType() == EventType.END;
        WorkflowEvent event = draft.toBuilder()
                .requestId(requestId)
                .sequence(sequence.incrementAndGet())
                .timestamp(clock.instant())
                .terminal(terminal)
                .build();

        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure()) {
            log.warn("Event {} #{} for {} not published: {}", event.getType(), event.getSequence(), requestId, result);
        }
        if (terminal) {
            terminated.set(true);
            sink.tryEmitComplete();
            log.info("🏁 Stream for {} terminated after {} events ({})", requestId, event.getSequence(),
                    event.getEnd() == null ? "-" : event.getEnd().getStatus());
        }
        return true;
    }

    public Flux<WorkflowEvent> events() {
        return sink.asFlux();
    }

    public boolean isTerminated() {
        return terminated.get();
    }

    public long lastSequence() {
        return sequence.get();
    }

    public String getRequestId() {
        return requestId;
    }
}
