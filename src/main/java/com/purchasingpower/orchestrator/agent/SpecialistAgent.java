package com.purchasingpower.orchestrator.agent;

/**
 * A domain specialist bound at startup.
 *
 * Implementations never throw: any failure comes back as a failed {@link AgentResponse}.
 */
public interface SpecialistAgent {

    String getDomain();

    DomainProfile getProfile();

    AgentResponse handle(AgentTask task);
}
