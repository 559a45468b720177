package com.purchasingpower.orchestrator.agent;

import com.purchasingpower.orchestrator.config.AgentConfig;
import com.purchasingpower.orchestrator.config.AgentConfig.DomainConfig;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Read-only description of a bound domain, as seen by the selector and the specialist.
 */
@Value
@Builder
public class DomainProfile {

    String name;
    String description;
    List<String> expertise;
    List<String> tools;
    String accessLevel;
    String promptFraming;
    double baseConfidence;
    int priority;

    public static DomainProfile from(String name, DomainConfig config) {
        return DomainProfile.builder()
                .name(name)
                .description(config.getDescription())
                .expertise(List.copyOf(config.getExpertise()))
                .tools(List.copyOf(config.getTools()))
                .accessLevel(config.getAccessLevel())
                .promptFraming(config.getPromptFraming())
                .baseConfidence(config.getBaseConfidence())
                .priority(config.getPriority())
                .build();
    }

    /**
     * Used when the configuration does not define a general domain.
     */
    public static DomainProfile general() {
        return DomainProfile.builder()
                .name(AgentConfig.GENERAL_DOMAIN)
                .description("General knowledge and anything no other domain covers")
                .expertise(List.of("general questions"))
                .tools(List.of())
                .accessLevel("public")
                .promptFraming("")
                .baseConfidence(0.5)
                .priority(Integer.MAX_VALUE)
                .build();
    }
}
