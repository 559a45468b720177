package com.purchasingpower.orchestrator.workflow;

import com.purchasingpower.orchestrator.model.QueryContext;
import com.purchasingpower.orchestrator.model.dto.EndPayload;
import com.purchasingpower.orchestrator.model.dto.EventType;
import com.purchasingpower.orchestrator.model.dto.WorkflowEvent;
import com.purchasingpower.orchestrator.support.TestFixtures;
import com.purchasingpower.orchestrator.workflow.event.WorkflowEventEmitter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Request Scope Tests")
class RequestScopeTest {

    private WorkflowEventEmitter emitter;
    private RequestScope scope;

    @BeforeEach
    void setUp() {
        emitter = new WorkflowEventEmitter("req-1", TestFixtures.FIXED_CLOCK);
        QueryContext context = QueryContext.builder().requestId("req-1").query("What is 2+2?").language("en").build();
        scope = new RequestScope(context, emitter, TestFixtures.FIXED_CLOCK);
    }

    @Test
    @DisplayName("Abandoned phase can no longer publish events")
    void emit_droppedAfterAbandon() {
        // Given
        assertThat(scope.emit(Phase.FINAL_RESPONSE, WorkflowEvent.fragment("The answer "))).isTrue();

        // When
        scope.abandon(Phase.FINAL_RESPONSE);
        boolean lateFragment = scope.emit(Phase.FINAL_RESPONSE, WorkflowEvent.fragment("is 4."));

        // Then
        assertThat(lateFragment).isFalse();
        assertThat(scope.isAbandoned(Phase.FINAL_RESPONSE)).isTrue();
        assertThat(scope.isAbandoned(Phase.EXECUTE_PLANNING)).isFalse();
        emitter.emit(WorkflowEvent.end(Phase.ERROR.getNodeName(), EndPayload.builder()
                .status(EndPayload.STATUS_ERROR).finalAnswer("timed out").build()));

        List<String> contents = emitter.events()
                .filter(event -> event.getType() == EventType.RESPONSE_FRAGMENT)
                .map(WorkflowEvent::getContent)
                .collectList()
                .block(Duration.ofSeconds(5));
        assertThat(contents).containsExactly("The answer ");
    }

    @Test
    @DisplayName("Abandoning one phase leaves the others free to publish")
    void emit_otherPhasesUnaffected() {
        // Given
        scope.abandon(Phase.SEMANTIC_REFLECTION);

        // When
        boolean published = scope.emit(Phase.EXECUTE_PLANNING, WorkflowEvent.start("specialists running"));

        // Then
        assertThat(published).isTrue();
        List<EventType> types = emitter.events().take(1).collectList().block(Duration.ofSeconds(5))
                .stream().map(WorkflowEvent::getType).collect(Collectors.toList());
        assertThat(types).containsExactly(EventType.START);
    }
}
