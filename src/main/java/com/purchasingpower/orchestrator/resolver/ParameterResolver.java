package com.purchasingpower.orchestrator.resolver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.purchasingpower.orchestrator.client.LLMCallOptions;
import com.purchasingpower.orchestrator.client.LLMProviderFactory;
import com.purchasingpower.orchestrator.exception.LLMProviderException;
import com.purchasingpower.orchestrator.exception.ParameterExtractionException;
import com.purchasingpower.orchestrator.registry.ParameterSpec;
import com.purchasingpower.orchestrator.registry.ParsedParameters;
import com.purchasingpower.orchestrator.registry.ToolContext;
import com.purchasingpower.orchestrator.registry.ToolSchema;
import com.purchasingpower.orchestrator.service.PromptLibraryService;
import com.purchasingpower.orchestrator.util.JsonExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Parameter Resolver - turns a natural language query into schema-valid tool parameters.
 *
 * One call is one extraction attempt. The prompt is built only from the schema, the query,
 * the caller's parameters, the caller's clock/timezone and the retry context, so identical
 * inputs always produce the identical prompt. The retry budget belongs to the caller
 * (see {@link com.purchasingpower.orchestrator.agent.ToolInvoker}).
 *
 * Merge order per declared parameter: extracted value, then caller value, then schema default.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ParameterResolver {

    static final String PROMPT = "parameter-extractor";

    private static final DateTimeFormatter NOW_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm (EEEE)", Locale.ENGLISH);

    private final LLMProviderFactory providerFactory;
    private final PromptLibraryService promptLibrary;
    private final ObjectMapper objectMapper;

    /**
     * @param capability   tool name
     * @param query        the text the specialist is answering
     * @param schema       the tool schema
     * @param priorParams  caller-supplied values; the extractor may override them
     * @param retryContext previous failure, or null on the first attempt
     * @param context      caller identity, timezone and clock
     * @throws ParameterExtractionException when the merged result does not satisfy the schema
     */
    public ParsedParameters resolve(String capability, String query, ToolSchema schema,
                                    Map<String, Object> priorParams, RetryContext retryContext,
                                    ToolContext context) {
        Map<String, Object> callerValues = declaredOnly(schema, priorParams);
        Set<String> implicated = retryContext == null || retryContext.getImplicatedFields() == null
                ? Set.of()
                : retryContext.getImplicatedFields();
        int attempt = retryContext == null ? 0 : retryContext.getAttempt();

        String prompt = buildPrompt(capability, query, schema, callerValues, retryContext, context);
        Map<String, Object> extracted = extract(capability, schema, prompt, callerValues, context.getRequestId());

        Map<String, Object> merged = new LinkedHashMap<>();
        Map<String, ParsedParameters.Source> provenance = new LinkedHashMap<>();
        for (ParameterSpec spec : schema.getParameters().values()) {
            String name = spec.getName();
            if (extracted.get(name) != null) {
                merged.put(name, spec.getType().coerce(extracted.get(name)));
                provenance.put(name, ParsedParameters.Source.EXTRACTED);
            } else if (callerValues.get(name) != null) {
                merged.put(name, spec.getType().coerce(callerValues.get(name)));
                provenance.put(name, ParsedParameters.Source.CALLER);
            } else if (spec.getDefaultValue() != null) {
                merged.put(name, spec.getDefaultValue());
                provenance.put(name, ParsedParameters.Source.DEFAULT);
            }
        }

        List<ParameterValidator.Violation> violations = ParameterValidator.validate(schema, merged, implicated);
        if (!violations.isEmpty()) {
            String message = ParameterValidator.describeAll(violations);
            log.warn("❌ Parameters for {} rejected (attempt {}): {}", capability, attempt + 1, message);
            throw new ParameterExtractionException(capability, message,
                    ParameterValidator.fieldsOf(violations), merged);
        }

        ParameterValidator.canonicalizeEnums(schema, merged);
        log.info("✅ Parameters for {} resolved (attempt {}): {}", capability, attempt + 1, merged.keySet());
        return new ParsedParameters(capability, merged, provenance, attempt);
    }

    String buildPrompt(String capability, String query, ToolSchema schema, Map<String, Object> callerValues,
                       RetryContext retryContext, ToolContext context) {
        ZoneId zone = context.getUserContext().zoneId();
        ZonedDateTime now = ZonedDateTime.now(context.getClock().withZone(zone)).truncatedTo(ChronoUnit.MINUTES);

        List<String> parameterLines = new ArrayList<>();
        for (ParameterSpec spec : schema.getParameters().values()) {
            parameterLines.add(describe(spec, schema.isRequired(spec.getName())));
        }

        Map<String, Object> variables = new HashMap<>();
        variables.put("capability", capability);
        variables.put("description", schema.getDescription());
        variables.put("query", query);
        variables.put("timezone", zone.getId());
        variables.put("now", NOW_FORMAT.format(now));
        variables.put("required", String.join(", ", schema.getRequiredParameters()));
        variables.put("optional", String.join(", ", schema.getOptionalParameters()));
        variables.put("parameters", parameterLines);
        variables.put("instructions", ExtractionInstructions.forCategory(schema.getCategory()));
        if (!callerValues.isEmpty()) {
            variables.put("callerParams", toSortedJson(callerValues));
        }
        if (retryContext != null) {
            Map<String, Object> retry = new HashMap<>();
            retry.put("attempt", retryContext.getAttempt());
            retry.put("previousParams", toSortedJson(retryContext.getPreviousParameters() == null
                    ? Map.of()
                    : retryContext.getPreviousParameters()));
            retry.put("error", retryContext.getErrorMessage());
            retry.put("fields", retryContext.getImplicatedFields() == null
                    ? ""
                    : String.join(", ", new TreeSet<>(retryContext.getImplicatedFields())));
            variables.put("retry", retry);
        }
        return promptLibrary.render(PROMPT, variables);
    }

    private Map<String, Object> extract(String capability, ToolSchema schema, String prompt,
                                        Map<String, Object> callerValues, String requestId) {
        LLMCallOptions options = promptLibrary.optionsFor(PROMPT, requestId);
        String answer;
        try {
            answer = providerFactory.getToolSelectionProvider().chat(prompt, options);
        } catch (LLMProviderException e) {
            throw new ParameterExtractionException(capability,
                    "Parameter extraction model call failed: " + e.getMessage(),
                    schema.getRequiredParameters(), callerValues, e);
        }

        String json = JsonExtractor.extractObject(answer).orElseThrow(() -> new ParameterExtractionException(
                capability, "Extractor answer contained no JSON object", schema.getRequiredParameters(),
                callerValues));
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {
            });
            Map<String, Object> declared = declaredOnly(schema, parsed);
            if (declared.size() < parsed.size()) {
                log.debug("Dropped undeclared keys for {}: {}", capability, difference(parsed, declared));
            }
            return declared;
        } catch (JsonProcessingException e) {
            throw new ParameterExtractionException(capability,
                    "Extractor answer is not valid JSON: " + e.getOriginalMessage(),
                    schema.getRequiredParameters(), callerValues, e);
        }
    }

    private static Map<String, Object> declaredOnly(ToolSchema schema, Map<String, Object> values) {
        Map<String, Object> declared = new LinkedHashMap<>();
        if (values == null) {
            return declared;
        }
        values.forEach((key, value) -> {
            if (schema.getParameters().containsKey(key) && value != null) {
                declared.put(key, value);
            }
        });
        return declared;
    }

    private static Set<String> difference(Map<String, Object> all, Map<String, Object> kept) {
        Set<String> dropped = new LinkedHashSet<>(all.keySet());
        dropped.removeAll(kept.keySet());
        return dropped;
    }

    private static String describe(ParameterSpec spec, boolean required) {
        StringBuilder line = new StringBuilder(spec.getName())
                .append(" (")
                .append(spec.getType().getJsonName());
        if (spec.getItemType() != null) {
            line.append(" of ").append(spec.getItemType().getJsonName());
        }
        line.append(required ? ", required" : ", optional");
        if (spec.hasEnum()) {
            line.append(", one of ").append(spec.getEnumValues());
        }
        if (spec.getDefaultValue() != null) {
            line.append(", default ").append(spec.getDefaultValue());
        }
        line.append("): ").append(spec.getDescription() == null ? "" : spec.getDescription());
        return line.toString();
    }

    private String toSortedJson(Map<String, Object> values) {
        try {
            return objectMapper.writer()
                    .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                    .writeValueAsString(new TreeMap<>(values));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Parameters are not serializable to JSON", e);
        }
    }
}
