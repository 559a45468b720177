package com.purchasingpower.orchestrator.exception;

import lombok.Getter;

@Getter
public class LLMProviderException extends OrchestrationException {

    private final String provider;
    private final String purpose;

    public LLMProviderException(String provider, String purpose, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.purpose = purpose;
    }
}
