package com.purchasingpower.orchestrator.config;

import com.purchasingpower.orchestrator.configuration.ExecutorProperties;
import com.purchasingpower.orchestrator.service.TenantSettingsService;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code @ConfigurationProperties} classes with Spring's binder.
 *
 * <ul>
 *   <li>{@link GlobalRetryConfig} - retry and backoff settings
 *   <li>{@link AgentConfig} - domain specialist definitions
 *   <li>{@link OrchestratorConfig} - workflow tunables
 *   <li>{@link ExecutorProperties} - thread pool sizing
 *   <li>{@link TenantSettingsService.TenantProperties} - per-tenant defaults
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    GlobalRetryConfig.class,
    AgentConfig.class,
    OrchestratorConfig.class,
    ExecutorProperties.class,
    TenantSettingsService.TenantProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
