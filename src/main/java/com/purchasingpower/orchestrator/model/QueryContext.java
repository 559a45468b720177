package com.purchasingpower.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable input of one orchestration request.
 *
 * Created once when the request is accepted and never modified afterwards. The
 * conversation history is already trimmed to the configured window.
 */
@Value
@Builder(toBuilder = true)
public class QueryContext implements Serializable {

    private static final long serialVersionUID = 1L;

    String requestId;
    String query;
    String language;
    String tenantId;
    String userId;
    UserContext userContext;
    List<ConversationTurn> history;
    /**
     * Caller-supplied tool parameters keyed by capability name. The extractor may override them.
     */
    Map<String, Map<String, Object>> toolParameters;
    Instant receivedAt;

    /**
     * Keeps the most recent {@code maxTurns} turns, oldest first.
     */
    public static List<ConversationTurn> window(List<ConversationTurn> turns, int maxTurns) {
        if (turns == null || turns.isEmpty() || maxTurns <= 0) {
            return List.of();
        }
        int from = Math.max(0, turns.size() - maxTurns);
        return List.copyOf(turns.subList(from, turns.size()));
    }

    public String renderHistory() {
        if (history == null || history.isEmpty()) {
            return "";
        }
        return history.stream()
                .map(turn -> turn.getRole() + ": " + turn.getContent())
                .collect(Collectors.joining("\n"));
    }

    public Map<String, Object> parametersFor(String capability) {
        if (toolParameters == null) {
            return Map.of();
        }
        Map<String, Object> params = toolParameters.get(capability);
        return params == null ? Map.of() : params;
    }

    public UserContext effectiveUserContext() {
        return userContext != null ? userContext : UserContext.anonymous();
    }
}
