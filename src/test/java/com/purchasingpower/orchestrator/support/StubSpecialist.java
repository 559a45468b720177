package com.purchasingpower.orchestrator.support;

import com.purchasingpower.orchestrator.agent.AgentResponse;
import com.purchasingpower.orchestrator.agent.AgentTask;
import com.purchasingpower.orchestrator.agent.DomainProfile;
import com.purchasingpower.orchestrator.agent.SpecialistAgent;

import java.util.List;
import java.util.function.Function;

/**
 * Specialist with a fixed profile and a scripted handler.
 */
public class StubSpecialist implements SpecialistAgent {

    private final DomainProfile profile;
    private final Function<AgentTask, AgentResponse> handler;

    public StubSpecialist(DomainProfile profile, Function<AgentTask, AgentResponse> handler) {
        this.profile = profile;
        this.handler = handler;
    }

    public static DomainProfile profile(String name, String accessLevel, String... tools) {
        return DomainProfile.builder()
                .name(name)
                .description(name + " questions")
                .expertise(List.of(name))
                .tools(List.of(tools))
                .accessLevel(accessLevel)
                .promptFraming("")
                .baseConfidence(0.5)
                .priority(100)
                .build();
    }

    public static StubSpecialist answering(String domain, String content, double confidence) {
        return new StubSpecialist(profile(domain, "public"), task -> AgentResponse.builder()
                .domain(domain)
                .content(content)
                .confidence(confidence)
                .evidence(List.of("specialist:" + domain))
                .success(true)
                .build());
    }

    @Override
    public String getDomain() {
        return profile.getName();
    }

    @Override
    public DomainProfile getProfile() {
        return profile;
    }

    @Override
    public AgentResponse handle(AgentTask task) {
        return handler.apply(task);
    }
}
