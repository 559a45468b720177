package com.purchasingpower.orchestrator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Domain specialist definitions.
 *
 * <p>Every entry under {@code app.agents.domains} becomes one specialist bound at startup.
 * The set is closed afterwards: selection output is validated against it.
 * <pre>
 * app:
 *   agents:
 *     domains:
 *       hr:
 *         description: "Human resources: attendance, leave, policies"
 *         expertise: [attendance, leave, onboarding]
 *         tools: [late_minutes, datetime]
 *         access-level: public
 *         priority: 10
 * </pre>
 *
 * <p>A {@code general} domain is always bound, even if absent here.
 */
@ConfigurationProperties(prefix = "app.agents")
@Validated
@Data
public class AgentConfig {

    public static final String GENERAL_DOMAIN = "general";

    @Valid
    private Map<String, DomainConfig> domains = new LinkedHashMap<>();

    @Data
    public static class DomainConfig {

        private boolean enabled = true;

        private String description = "";

        private List<String> expertise = new ArrayList<>();

        /**
         * Capability names this domain may call, in preference order.
         */
        private List<String> tools = new ArrayList<>();

        /**
         * "public" or a scope/department name the caller must hold.
         */
        private String accessLevel = "public";

        /**
         * Extra instructions framing how this specialist phrases its answer.
         */
        private String promptFraming = "";

        /**
         * Confidence reported when the specialist answers without any tool.
         * Placeholder value, not derived from any signal.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double baseConfidence = 0.5;

        /**
         * Lower values come first when the selector lists domains.
         */
        private int priority = 100;
    }
}
