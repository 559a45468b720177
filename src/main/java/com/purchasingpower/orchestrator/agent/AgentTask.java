package com.purchasingpower.orchestrator.agent;

import com.purchasingpower.orchestrator.model.QueryContext;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One unit of work for one specialist.
 */
@Value
@Builder
public class AgentTask {

    String requestId;
    String domain;

    /**
     * Refined query when reflection produced one, otherwise the raw query.
     */
    String query;

    String language;
    QueryContext context;

    /**
     * Tools the selector suggested for this domain; empty means the specialist decides.
     */
    List<String> plannedTools;
}
