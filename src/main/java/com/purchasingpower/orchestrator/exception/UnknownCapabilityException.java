package com.purchasingpower.orchestrator.exception;

import lombok.Getter;

@Getter
public class UnknownCapabilityException extends OrchestrationException {

    private final String capability;

    public UnknownCapabilityException(String capability) {
        super("No capability registered under name: " + capability);
        this.capability = capability;
    }
}
