package com.purchasingpower.orchestrator.service;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Per-tenant defaults (timezone, language) for whatever a request leaves out.
 *
 * Reads go through a Guava {@link LoadingCache}, which loads each tenant at most once at a
 * time and never blocks reads of other tenants. Invalidation is the only mutation.
 */
@Slf4j
@Service
public class TenantSettingsService {

    public static final String DEFAULT_TENANT = "default";

    private final TenantProperties properties;
    private final LoadingCache<String, TenantSettings> cache;

    public TenantSettingsService(TenantProperties properties) {
        this.properties = properties;
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(properties.getCacheSize())
                .expireAfterWrite(properties.getCacheTtl())
                .build(new CacheLoader<>() {
                    @Override
                    public TenantSettings load(String tenantId) {
                        return resolve(tenantId);
                    }
                });
    }

    public TenantSettings settingsFor(String tenantId) {
        String key = tenantId == null || tenantId.isBlank()
                ? DEFAULT_TENANT
                : tenantId.trim().toLowerCase(Locale.ROOT);
        return cache.getUnchecked(key);
    }

    public void invalidate(String tenantId) {
        cache.invalidate(tenantId.trim().toLowerCase(Locale.ROOT));
        log.info("Tenant settings for {} invalidated", tenantId);
    }

    public void invalidateAll() {
        cache.invalidateAll();
        log.info("All tenant settings invalidated");
    }

    private TenantSettings resolve(String tenantId) {
        TenantSettings defaults = properties.getDefaults();
        TenantSettings configured = properties.getOverrides().get(tenantId);
        if (configured == null) {
            log.debug("No settings for tenant {}, using defaults", tenantId);
            return defaults;
        }
        TenantSettings merged = new TenantSettings();
        merged.setTimezone(configured.getTimezone() != null ? configured.getTimezone() : defaults.getTimezone());
        merged.setLanguage(configured.getLanguage() != null ? configured.getLanguage() : defaults.getLanguage());
        return merged;
    }

    @Data
    public static class TenantSettings {
        private String timezone = "UTC";
        private String language = "en";
    }

    /**
     * <pre>
     * app:
     *   tenants:
     *     defaults: { timezone: UTC, language: en }
     *     overrides:
     *       acme-vn: { timezone: Asia/Ho_Chi_Minh, language: vi }
     * </pre>
     */
    @Data
    @ConfigurationProperties(prefix = "app.tenants")
    public static class TenantProperties {
        private TenantSettings defaults = new TenantSettings();
        private Map<String, TenantSettings> overrides = new LinkedHashMap<>();
        private long cacheSize = 1000;
        private Duration cacheTtl = Duration.ofMinutes(10);
    }
}
