package com.purchasingpower.orchestrator.registry;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Declared type of a tool parameter and the shape check that goes with it.
 */
public enum ParameterType {
    STRING("string"),
    INTEGER("integer"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    ARRAY("array"),
    OBJECT("object");

    private final String jsonName;

    ParameterType(String jsonName) {
        this.jsonName = jsonName;
    }

    public String getJsonName() {
        return jsonName;
    }

    public boolean matches(Object value) {
        if (value == null) {
            return false;
        }
        switch (this) {
            case STRING:
                return value instanceof String;
            case INTEGER:
                return value instanceof Integer || value instanceof Long
                        || (value instanceof Number && isWhole(((Number) value).doubleValue()));
            case NUMBER:
                return value instanceof Number;
            case BOOLEAN:
                return value instanceof Boolean;
            case ARRAY:
                return value instanceof Collection || value.getClass().isArray();
            case OBJECT:
                return value instanceof Map;
            default:
                return false;
        }
    }

    /**
     * Loosens scalar strings into the declared scalar type ("5" to 5, "true" to true).
     * Never turns a scalar into an array or object; returns the value untouched when no
     * safe conversion exists.
     */
    public Object coerce(Object value) {
        if (!(value instanceof String) || matches(value)) {
            return value;
        }
        String text = ((String) value).trim();
        try {
            switch (this) {
                case INTEGER:
                    return Long.parseLong(text);
                case NUMBER:
                    return Double.parseDouble(text);
                case BOOLEAN:
                    String lower = text.toLowerCase(Locale.ROOT);
                    if ("true".equals(lower) || "false".equals(lower)) {
                        return Boolean.parseBoolean(lower);
                    }
                    return value;
                default:
                    return value;
            }
        } catch (NumberFormatException e) {
            return value;
        }
    }

    public static ParameterType fromJsonName(String name) {
        for (ParameterType type : values()) {
            if (type.jsonName.equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown parameter type: " + name);
    }

    private static boolean isWhole(double value) {
        return !Double.isInfinite(value) && value == Math.rint(value);
    }
}
