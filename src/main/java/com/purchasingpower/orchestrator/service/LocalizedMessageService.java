package com.purchasingpower.orchestrator.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * User-facing messages per language, loaded from {@code classpath:messages/<lang>.yaml}.
 *
 * Unknown languages and missing keys fall back to English, then to the key itself.
 */
@Slf4j
@Service
public class LocalizedMessageService {

    public static final String DEFAULT_LANGUAGE = "en";

    private static final String MESSAGE_LOCATION = "classpath:messages/*.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final Map<String, Map<String, String>> messages = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadMessages() {
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver().getResources(MESSAGE_LOCATION);
            for (Resource resource : resources) {
                String filename = resource.getFilename();
                if (filename == null) {
                    continue;
                }
                String language = filename.substring(0, filename.lastIndexOf('.')).toLowerCase(Locale.ROOT);
                try (InputStream in = resource.getInputStream()) {
                    messages.put(language, yamlMapper.readValue(in, new TypeReference<Map<String, String>>() {
                    }));
                }
            }
            log.info("Loaded messages for languages {}", messages.keySet());
        } catch (IOException e) {
            log.error("Failed to load localized messages", e);
            throw new IllegalStateException("Localized message initialization failed", e);
        }
    }

    public String get(String key, String language) {
        String text = lookup(normalize(language), key);
        if (text == null) {
            text = lookup(DEFAULT_LANGUAGE, key);
        }
        return text == null ? key : text;
    }

    public boolean supports(String language) {
        return messages.containsKey(normalize(language));
    }

    private String lookup(String language, String key) {
        Map<String, String> bundle = messages.get(language);
        return bundle == null ? null : bundle.get(key);
    }

    private static String normalize(String language) {
        if (language == null || language.isBlank()) {
            return DEFAULT_LANGUAGE;
        }
        String lower = language.trim().toLowerCase(Locale.ROOT);
        int separator = lower.indexOf('-') >= 0 ? lower.indexOf('-') : lower.indexOf('_');
        return separator > 0 ? lower.substring(0, separator) : lower;
    }
}
