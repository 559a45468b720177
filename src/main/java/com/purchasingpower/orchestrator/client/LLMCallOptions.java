package com.purchasingpower.orchestrator.client;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Per-call options handed to an {@link LLMProvider}.
 */
@Value
@Builder(toBuilder = true)
public class LLMCallOptions {

    /**
     * Which component is calling (agent-selector, parameter-extractor, ...). Used for logs.
     */
    String purpose;

    String requestId;

    /**
     * Sampling temperature; null keeps the provider default.
     */
    Double temperature;

    /**
     * The caller expects a JSON object back.
     */
    boolean jsonOutput;

    /**
     * Routing and extraction calls that must not sample.
     */
    boolean deterministic;

    Duration timeout;

    public static LLMCallOptions of(String purpose, String requestId) {
        return LLMCallOptions.builder().purpose(purpose).requestId(requestId).build();
    }
}
