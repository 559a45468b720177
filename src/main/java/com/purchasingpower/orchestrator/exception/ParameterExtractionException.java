package com.purchasingpower.orchestrator.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Raised when extracted tool parameters do not satisfy the tool schema.
 *
 * Carries the offending field names and the parameter map that was rejected so the
 * caller can feed both back into the next extraction attempt.
 */
@Getter
public class ParameterExtractionException extends OrchestrationException {

    private final String capability;
    private final Set<String> fields;
    private final Map<String, Object> rejectedParameters;

    public ParameterExtractionException(String capability, String message, Set<String> fields,
                                        Map<String, Object> rejectedParameters) {
        this(capability, message, fields, rejectedParameters, null);
    }

    public ParameterExtractionException(String capability, String message, Set<String> fields,
                                        Map<String, Object> rejectedParameters, Throwable cause) {
        super(message, cause);
        this.capability = capability;
        this.fields = Collections.unmodifiableSet(new LinkedHashSet<>(fields));
        this.rejectedParameters = rejectedParameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(rejectedParameters));
    }
}
