package com.purchasingpower.orchestrator.exception;

import lombok.Getter;

@Getter
public class RequestNotFoundException extends OrchestrationException {

    private final String requestId;

    public RequestNotFoundException(String requestId) {
        super("No active request: " + requestId);
        this.requestId = requestId;
    }
}
