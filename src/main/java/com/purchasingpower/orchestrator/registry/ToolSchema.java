package com.purchasingpower.orchestrator.registry;

import lombok.Value;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Typed parameter schema of one capability.
 *
 * Parameters keep their declaration order so prompts built from a schema are
 * byte-for-byte stable across calls.
 */
@Value
public class ToolSchema implements Serializable {

    private static final long serialVersionUID = 1L;

    String name;
    String description;
    Tool.ToolCategory category;
    String version;
    String accessLevel;
    Map<String, ParameterSpec> parameters;
    Set<String> requiredParameters;

    private ToolSchema(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.category = builder.category;
        this.version = builder.version;
        this.accessLevel = builder.accessLevel;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
        this.requiredParameters = Collections.unmodifiableSet(new LinkedHashSet<>(builder.required));
    }

    public List<String> getOptionalParameters() {
        List<String> optional = new ArrayList<>();
        for (String param : parameters.keySet()) {
            if (!requiredParameters.contains(param)) {
                optional.add(param);
            }
        }
        return optional;
    }

    public Optional<ParameterSpec> parameter(String paramName) {
        return Optional.ofNullable(parameters.get(paramName));
    }

    public boolean isRequired(String paramName) {
        return requiredParameters.contains(paramName);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private String description = "";
        private Tool.ToolCategory category = Tool.ToolCategory.GENERAL;
        private String version = "1";
        private String accessLevel = "public";
        private final Map<String, ParameterSpec> parameters = new LinkedHashMap<>();
        private final Set<String> required = new LinkedHashSet<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(Tool.ToolCategory category) {
            this.category = category;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder accessLevel(String accessLevel) {
            this.accessLevel = accessLevel;
            return this;
        }

        public Builder required(ParameterSpec spec) {
            parameters.put(spec.getName(), spec);
            required.add(spec.getName());
            return this;
        }

        public Builder optional(ParameterSpec spec) {
            parameters.put(spec.getName(), spec);
            return this;
        }

        public ToolSchema build() {
            if (name == null || name.isBlank()) {
                throw new IllegalStateException("Tool schema needs a name");
            }
            return new ToolSchema(this);
        }
    }
}
