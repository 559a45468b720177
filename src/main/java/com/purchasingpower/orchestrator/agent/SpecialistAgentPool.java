package com.purchasingpower.orchestrator.agent;

import com.purchasingpower.orchestrator.client.LLMProviderFactory;
import com.purchasingpower.orchestrator.config.AgentConfig;
import com.purchasingpower.orchestrator.model.UserContext;
import com.purchasingpower.orchestrator.registry.CapabilityRegistry;
import com.purchasingpower.orchestrator.service.PromptLibraryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The closed set of specialists, bound once at startup from {@code app.agents.domains}.
 *
 * Domains are ordered by priority. The map never changes after construction.
 */
@Slf4j
@Component
public class SpecialistAgentPool {

    private final Map<String, SpecialistAgent> agents;

    @Autowired
    public SpecialistAgentPool(AgentConfig agentConfig, CapabilityRegistry registry, ToolInvoker toolInvoker,
                               LLMProviderFactory providerFactory, PromptLibraryService promptLibrary,
                               Clock clock) {
        List<DomainProfile> profiles = new ArrayList<>();
        agentConfig.getDomains().forEach((name, config) -> {
            if (config.isEnabled()) {
                profiles.add(DomainProfile.from(name, config));
            } else {
                log.info("Domain {} is disabled", name);
            }
        });
        if (profiles.stream().noneMatch(profile -> AgentConfig.GENERAL_DOMAIN.equals(profile.getName()))) {
            profiles.add(DomainProfile.general());
        }
        profiles.sort(Comparator.comparingInt(DomainProfile::getPriority).thenComparing(DomainProfile::getName));

        Map<String, SpecialistAgent> bound = new LinkedHashMap<>();
        for (DomainProfile profile : profiles) {
            bound.put(profile.getName(),
                    new DomainSpecialist(profile, registry, toolInvoker, providerFactory, promptLibrary, clock));
        }
        this.agents = Collections.unmodifiableMap(bound);
        log.info("🤖 Specialist pool bound {} domains: {}", agents.size(), agents.keySet());
    }

    private SpecialistAgentPool(Map<String, SpecialistAgent> agents) {
        this.agents = Collections.unmodifiableMap(agents);
    }

    /**
     * Builds a pool from already constructed specialists, keeping their order.
     */
    public static SpecialistAgentPool of(List<SpecialistAgent> specialists) {
        Map<String, SpecialistAgent> bound = new LinkedHashMap<>();
        specialists.forEach(agent -> bound.put(agent.getDomain(), agent));
        return new SpecialistAgentPool(bound);
    }

    public Optional<SpecialistAgent> get(String domain) {
        return Optional.ofNullable(agents.get(domain));
    }

    public boolean isBound(String domain) {
        return agents.containsKey(domain);
    }

    public Set<String> domains() {
        return agents.keySet();
    }

    /**
     * Domains the caller may be routed to, in priority order. General is always included.
     */
    public List<DomainProfile> eligibleDomains(UserContext user) {
        return agents.values().stream()
                .map(SpecialistAgent::getProfile)
                .filter(profile -> AgentConfig.GENERAL_DOMAIN.equals(profile.getName())
                        || user.canAccess(profile.getAccessLevel()))
                .collect(Collectors.toList());
    }
}
