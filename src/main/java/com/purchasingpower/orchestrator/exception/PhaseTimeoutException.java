package com.purchasingpower.orchestrator.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class PhaseTimeoutException extends OrchestrationException {

    private final String phase;
    private final Duration timeout;

    public PhaseTimeoutException(String phase, Duration timeout) {
        super("Phase " + phase + " exceeded its timeout of " + timeout.toMillis() + "ms");
        this.phase = phase;
        this.timeout = timeout;
    }
}
