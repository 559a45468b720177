package com.purchasingpower.orchestrator.service;

import com.purchasingpower.orchestrator.exception.LLMProviderException;
import com.purchasingpower.orchestrator.model.dto.EndPayload;
import com.purchasingpower.orchestrator.model.dto.EventType;
import com.purchasingpower.orchestrator.model.dto.ExecutionMetadata;
import com.purchasingpower.orchestrator.model.dto.QueryRequest;
import com.purchasingpower.orchestrator.model.dto.WorkflowEvent;
import com.purchasingpower.orchestrator.support.ScriptedLLMConfig;
import com.purchasingpower.orchestrator.support.ScriptedLLMProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Deadline handling with short phase timeouts: a phase that overruns, and a specialist that
 * misses the fan-out deadline while another one answers.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(ScriptedLLMConfig.class)
@TestPropertySource(properties = {
        "app.orchestrator.timeouts.final-response=1s",
        "app.orchestrator.timeouts.execute-planning=3s"
})
@DisplayName("Workflow Timeout Tests")
class WorkflowTimeoutTest {

    private static final Duration WAIT = Duration.ofSeconds(20);
    private static final long SLOW_MODEL_MS = 8_000;

    @Autowired
    private OrchestrationService orchestrationService;

    @Autowired
    private ScriptedLLMProvider scripted;

    @Autowired
    private LocalizedMessageService messages;

    @BeforeEach
    void setUp() {
        scripted.reset();
    }

    @Test
    @DisplayName("Final response that overruns its timeout ends with one timeout error and no late fragments")
    void finalResponse_timesOut() throws Exception {
        // Given
        scripted.on("semantic-reflection",
                "{\"detected_language\":\"en\",\"is_chitchat\":true,\"refined_query\":\"hello\"}");
        scripted.onAnswer("chitchat", prompt -> slowAnswer("chitchat", "Hello there!"));
        scripted.on("follow-up-questions", "{\"questions\":[\"Anything else?\"]}");

        // When
        RequestHandle handle = orchestrationService.submit(QueryRequest.builder().query("hello").build());
        EndPayload end = handle.completion().get(WAIT.toSeconds(), TimeUnit.SECONDS);
        List<WorkflowEvent> events = handle.events().collectList().block(WAIT);

        // Then
        assertThat(end.getStatus()).isEqualTo(EndPayload.STATUS_ERROR);
        assertThat(end.getFinalAnswer()).isEqualTo(messages.get("error_timeout", "en"));
        assertThat(events.stream().filter(event -> event.getType() == EventType.END)).hasSize(1);
        assertThat(types(events))
                .doesNotContain(EventType.RESPONSE_FRAGMENT)
                .doesNotContain(EventType.FOLLOWUP);
        assertThat(end.getMetadata().getFailures())
                .extracting(ExecutionMetadata.Failure::phase, ExecutionMetadata.Failure::kind)
                .contains(tuple("final_response", "TIMEOUT"));
        assertThat(scripted.callCount("follow-up-questions")).isZero();
    }

    @Test
    @DisplayName("Specialist that misses the fan-out deadline is reported while the other answer is used")
    void executePlanning_partialSuccess() throws Exception {
        // Given
        scripted.on("semantic-reflection",
                "{\"detected_language\":\"en\",\"is_chitchat\":false,\"refined_query\":\"What is 2+2?\"}");
        scripted.on("agent-selector",
                "{\"selected_agents\":[\"calculator\",\"finance\"],\"complexity_score\":0.9,\"confidence\":0.8,"
                        + "\"cross_domain\":true}");
        scripted.on("parameter-extractor", "{\"expression\":\"2+2\"}");
        scripted.onAnswer("specialist-response", prompt -> prompt.contains("You are the finance specialist")
                ? slowAnswer("specialist-response", "Four dollars")
                : "2 + 2 = 4");
        scripted.on("final-response", "The answer is 4.");
        scripted.on("follow-up-questions", "{\"questions\":[]}");

        // When
        RequestHandle handle = orchestrationService.submit(QueryRequest.builder().query("What is 2+2?").build());
        EndPayload end = handle.completion().get(WAIT.toSeconds(), TimeUnit.SECONDS);
        List<WorkflowEvent> events = handle.events().collectList().block(WAIT);

        // Then
        assertThat(end.getStatus()).isEqualTo(EndPayload.STATUS_COMPLETED);
        assertThat(end.getFinalAnswer()).isEqualTo("The answer is 4.");
        assertThat(end.getMetadata().getRoutingDecision()).isEqualTo("SINGLE_RESPONSE");
        assertThat(end.getMetadata().getDomainsInvoked()).containsExactlyInAnyOrder("calculator", "finance");
        assertThat(end.getMetadata().getFailures())
                .containsExactly(new ExecutionMetadata.Failure("execute_planning", "finance", "TIMEOUT"));
        assertThat(events.stream().filter(WorkflowEvent::isTerminal)).hasSize(1);
    }

    private static String slowAnswer(String purpose, String answer) {
        try {
            Thread.sleep(SLOW_MODEL_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LLMProviderException("scripted", purpose, "interrupted", e);
        }
        return answer;
    }

    private static List<EventType> types(List<WorkflowEvent> events) {
        return events.stream().map(WorkflowEvent::getType).collect(Collectors.toList());
    }
}
