package com.purchasingpower.orchestrator.registry;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.io.Serializable;
import java.util.List;

@Value
@Builder
public class ParameterSpec implements Serializable {

    private static final long serialVersionUID = 1L;

    String name;
    ParameterType type;
    String description;
    @Singular("enumValue")
    List<String> enumValues;
    /**
     * Default applied when an optional parameter is absent.
     */
    Object defaultValue;
    /**
     * Element type for arrays.
     */
    ParameterType itemType;

    public boolean hasEnum() {
        return enumValues != null && !enumValues.isEmpty();
    }
}
