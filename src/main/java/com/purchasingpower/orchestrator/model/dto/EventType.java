package com.purchasingpower.orchestrator.model.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event taxonomy of the caller-facing stream, with the numeric tag clients switch on.
 */
public enum EventType {
    START(1, "start"),
    PLAN(2, "plan"),
    RESPONSE_FRAGMENT(3, "response-fragment"),
    FOLLOWUP(4, "followup"),
    END(5, "end");

    private final int tag;
    private final String eventName;

    EventType(int tag, String eventName) {
        this.tag = tag;
        this.eventName = eventName;
    }

    public int getTag() {
        return tag;
    }

    /**
     * SSE event name.
     */
    @JsonValue
    public String getEventName() {
        return eventName;
    }
}
