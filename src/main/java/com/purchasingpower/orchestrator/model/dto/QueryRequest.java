package com.purchasingpower.orchestrator.model.dto;

import com.purchasingpower.orchestrator.model.ConversationTurn;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for running a query through the orchestrator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    @NotBlank
    @Size(max = 4000)
    private String query;

    /**
     * Preferred answer language; falls back to the tenant default.
     */
    private String language;

    private String tenantId;
    private String userId;

    @Valid
    private CallerContext user;

    @Builder.Default
    private List<ConversationTurn> history = new ArrayList<>();

    /**
     * Known tool parameters keyed by capability name, e.g. {"datetime": {"timezone": "Asia/Tokyo"}}.
     */
    private Map<String, Map<String, Object>> toolParameters;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class CallerContext {
        private String role;
        private String department;
        @Builder.Default
        private List<String> accessScope = new ArrayList<>();
        private String timezone;
    }
}
