package com.purchasingpower.orchestrator.registry;

import com.purchasingpower.orchestrator.model.UserContext;

import java.time.Clock;

/**
 * Context handed to a tool during execution.
 */
public interface ToolContext {

    String getRequestId();

    /**
     * The query the owning specialist is answering.
     */
    String getQuery();

    UserContext getUserContext();

    Clock getClock();

    static ToolContext of(String requestId, String query, UserContext userContext, Clock clock) {
        return new ToolContextImpl(requestId, query, userContext, clock);
    }
}

record ToolContextImpl(String requestId, String query, UserContext userContext, Clock clock)
        implements ToolContext {

    @Override
    public String getRequestId() {
        return requestId;
    }

    @Override
    public String getQuery() {
        return query;
    }

    @Override
    public UserContext getUserContext() {
        return userContext;
    }

    @Override
    public Clock getClock() {
        return clock;
    }
}
