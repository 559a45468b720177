package com.purchasingpower.orchestrator.registry;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Schema-valid parameters for one tool invocation attempt.
 *
 * Remembers where every value came from: supplied by the caller, extracted by the
 * model, or filled from a schema default.
 */
@Getter
public final class ParsedParameters {

    public enum Source { CALLER, EXTRACTED, DEFAULT }

    private final String capability;
    private final Map<String, Object> values;
    private final Map<String, Source> provenance;
    private final int attempt;

    public ParsedParameters(String capability, Map<String, Object> values, Map<String, Source> provenance,
                            int attempt) {
        this.capability = capability;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.provenance = Collections.unmodifiableMap(new LinkedHashMap<>(provenance));
        this.attempt = attempt;
    }

    /**
     * Direct construction for callers that already hold validated values (tests, internal tools).
     */
    public static ParsedParameters of(String capability, Map<String, Object> values) {
        Map<String, Source> provenance = new LinkedHashMap<>();
        values.keySet().forEach(key -> provenance.put(key, Source.CALLER));
        return new ParsedParameters(capability, values, provenance, 0);
    }

    public boolean contains(String name) {
        return values.containsKey(name) && values.get(name) != null;
    }

    public Object get(String name) {
        return values.get(name);
    }

    public Optional<String> getString(String name) {
        Object value = values.get(name);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public Optional<Long> getLong(String name) {
        Object value = values.get(name);
        if (value instanceof Number) {
            return Optional.of(((Number) value).longValue());
        }
        return Optional.empty();
    }

    public Optional<Double> getDouble(String name) {
        Object value = values.get(name);
        if (value instanceof Number) {
            return Optional.of(((Number) value).doubleValue());
        }
        return Optional.empty();
    }

    public List<String> getStringList(String name) {
        Object value = values.get(name);
        List<String> result = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (item != null && !item.toString().isBlank()) {
                    result.add(item.toString().trim());
                }
            }
        }
        return result;
    }

    public Set<String> namesFrom(Source source) {
        Set<String> names = new LinkedHashSet<>();
        provenance.forEach((name, origin) -> {
            if (origin == source) {
                names.add(name);
            }
        });
        return names;
    }

    @Override
    public String toString() {
        return "ParsedParameters{" + capability + ", attempt=" + attempt + ", values=" + values + "}";
    }
}
