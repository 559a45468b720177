package com.purchasingpower.orchestrator.resolver;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * What went wrong on the previous extraction attempt of the same tool call.
 */
@Value
@Builder
public class RetryContext {

    /**
     * 1 for the first repair, 2 for the second, ...
     */
    int attempt;
    Map<String, Object> previousParameters;
    String errorMessage;
    Set<String> implicatedFields;
}
