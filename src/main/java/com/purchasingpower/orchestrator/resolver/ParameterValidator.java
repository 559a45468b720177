package com.purchasingpower.orchestrator.resolver;

import com.purchasingpower.orchestrator.registry.ParameterSpec;
import com.purchasingpower.orchestrator.registry.ParameterType;
import com.purchasingpower.orchestrator.registry.ToolSchema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks merged parameters against a tool schema.
 *
 * Required coverage and declared types are checked on every attempt. Fields implicated
 * by the previous failure are additionally held to their full shape: a non-empty array
 * whose items match the item type, or a non-blank string.
 */
final class ParameterValidator {

    private ParameterValidator() {
    }

    record Violation(String field, String message) {
    }

    static List<Violation> validate(ToolSchema schema, Map<String, Object> values, Set<String> implicated) {
        List<Violation> violations = new ArrayList<>();

        for (String required : schema.getRequiredParameters()) {
            if (isMissing(values.get(required))) {
                violations.add(new Violation(required, "missing required parameter '" + required + "'"));
            }
        }

        for (Map.Entry<String, Object> entry : values.entrySet()) {
            ParameterSpec spec = schema.getParameters().get(entry.getKey());
            Object value = entry.getValue();
            if (spec == null || value == null) {
                continue;
            }
            if (!spec.getType().matches(value)) {
                violations.add(new Violation(spec.getName(), "'" + spec.getName() + "' must be "
                        + article(spec.getType()) + " but was " + describe(value)));
                continue;
            }
            if (spec.hasEnum() && value instanceof String && !allowed(spec, (String) value)) {
                violations.add(new Violation(spec.getName(), "'" + spec.getName() + "' must be one of "
                        + spec.getEnumValues() + " but was '" + value + "'"));
            }
            if (implicated.contains(spec.getName())) {
                checkShape(spec, value, violations);
            }
        }
        return violations;
    }

    static Set<String> fieldsOf(List<Violation> violations) {
        Set<String> fields = new LinkedHashSet<>();
        violations.forEach(violation -> fields.add(violation.field()));
        return fields;
    }

    static String describeAll(List<Violation> violations) {
        List<String> messages = new ArrayList<>();
        violations.forEach(violation -> messages.add(violation.message()));
        return String.join("; ", messages);
    }

    private static void checkShape(ParameterSpec spec, Object value, List<Violation> violations) {
        if (spec.getType() == ParameterType.ARRAY && value instanceof Collection) {
            Collection<?> items = (Collection<?>) value;
            if (items.isEmpty()) {
                violations.add(new Violation(spec.getName(), "'" + spec.getName() + "' must not be an empty array"));
                return;
            }
            if (spec.getItemType() != null) {
                for (Object item : items) {
                    if (!spec.getItemType().matches(item)) {
                        violations.add(new Violation(spec.getName(), "'" + spec.getName() + "' items must be "
                                + article(spec.getItemType()) + " but found " + describe(item)));
                        return;
                    }
                }
            }
        } else if (spec.getType() == ParameterType.STRING && value.toString().isBlank()) {
            violations.add(new Violation(spec.getName(), "'" + spec.getName() + "' must not be blank"));
        }
    }

    private static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String) {
            return ((String) value).isBlank();
        }
        return value instanceof Collection && ((Collection<?>) value).isEmpty();
    }

    /**
     * Rewrites accepted enum values to their declared spelling, so tools only ever see
     * {@code "week"} and never {@code "Week"}.
     */
    static void canonicalizeEnums(ToolSchema schema, Map<String, Object> values) {
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            ParameterSpec spec = schema.getParameters().get(entry.getKey());
            if (spec != null && spec.hasEnum() && entry.getValue() instanceof String) {
                declared(spec, (String) entry.getValue()).ifPresent(entry::setValue);
            }
        }
    }

    private static boolean allowed(ParameterSpec spec, String value) {
        return declared(spec, value).isPresent();
    }

    private static Optional<String> declared(ParameterSpec spec, String value) {
        String wanted = value.trim().toLowerCase(Locale.ROOT);
        return spec.getEnumValues().stream()
                .filter(option -> option.toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    private static String article(ParameterType type) {
        String name = type.getJsonName();
        return (name.startsWith("a") || name.startsWith("i") || name.startsWith("o") ? "an " : "a ") + name;
    }

    private static String describe(Object value) {
        if (value instanceof String) {
            return "a string (\"" + value + "\")";
        }
        if (value instanceof Collection) {
            return "an array";
        }
        if (value instanceof Map) {
            return "an object";
        }
        if (value instanceof Boolean) {
            return "a boolean";
        }
        if (value instanceof Number) {
            return "a number (" + value + ")";
        }
        return value.getClass().getSimpleName();
    }
}
