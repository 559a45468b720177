package com.purchasingpower.orchestrator.workflow.event;

import com.purchasingpower.orchestrator.model.dto.EndPayload;
import com.purchasingpower.orchestrator.model.dto.EventType;
import com.purchasingpower.orchestrator.model.dto.WorkflowEvent;
import com.purchasingpower.orchestrator.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Workflow Event Emitter Tests")
class WorkflowEventEmitterTest {

    @Test
    @DisplayName("Events are stamped with strictly increasing sequence numbers")
    void emit_stampsSequence() {
        // Given
        WorkflowEventEmitter emitter = new WorkflowEventEmitter("req-1", TestFixtures.FIXED_CLOCK);

        // When
        emitter.emit(WorkflowEvent.start("Processing"));
        emitter.emit(WorkflowEvent.fragment("4"));
        emitter.emit(WorkflowEvent.end("final_response", EndPayload.builder()
                .status(EndPayload.STATUS_COMPLETED).finalAnswer("4").build()));

        // Then
        StepVerifier.create(emitter.events())
                .assertNext(event -> {
                    assertThat(event.getSequence()).isEqualTo(1);
                    assertThat(event.getRequestId()).isEqualTo("req-1");
                    assertThat(event.getType()).isEqualTo(EventType.START);
                    assertThat(event.isTerminal()).isFalse();
                })
                .assertNext(event -> assertThat(event.getSequence()).isEqualTo(2))
                .assertNext(event -> {
                    assertThat(event.getSequence()).isEqualTo(3);
                    assertThat(event.isTerminal()).isTrue();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Nothing is published after the terminal event")
    void emit_dropsAfterEnd() {
        // Given
        WorkflowEventEmitter emitter = new WorkflowEventEmitter("req-2", TestFixtures.FIXED_CLOCK);
        emitter.emit(WorkflowEvent.end("error", EndPayload.builder().status(EndPayload.STATUS_ERROR).build()));

        // When
        boolean fragmentAccepted = emitter.emit(WorkflowEvent.fragment("late"));
        boolean secondEndAccepted = emitter.emit(WorkflowEvent.end("error",
                EndPayload.builder().status(EndPayload.STATUS_ERROR).build()));

        // Then
        assertThat(fragmentAccepted).isFalse();
        assertThat(secondEndAccepted).isFalse();
        assertThat(emitter.lastSequence()).isEqualTo(1);
        StepVerifier.create(emitter.events())
                .expectNextCount(1)
                .verifyComplete();
    }

    @Test
    @DisplayName("Concurrent producers never share or reorder sequence numbers")
    void emit_concurrentProducers() throws InterruptedException {
        // Given
        WorkflowEventEmitter emitter = new WorkflowEventEmitter("req-3", TestFixtures.FIXED_CLOCK);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        int producers = 8;
        int perProducer = 50;

        // When
        for (int p = 0; p < producers; p++) {
            pool.execute(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perProducer; i++) {
                        emitter.emit(WorkflowEvent.fragment("x"));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        emitter.emit(WorkflowEvent.end("final_response", EndPayload.builder()
                .status(EndPayload.STATUS_COMPLETED).build()));

        // Then
        List<WorkflowEvent> events = emitter.events().collectList().block(Duration.ofSeconds(5));
        assertThat(events).hasSize(producers * perProducer + 1);
        List<Long> sequences = new ArrayList<>();
        events.forEach(event -> sequences.add(event.getSequence()));
        assertThat(sequences).isSorted().doesNotHaveDuplicates();
        assertThat(events.get(events.size() - 1).isTerminal()).isTrue();
    }
}
