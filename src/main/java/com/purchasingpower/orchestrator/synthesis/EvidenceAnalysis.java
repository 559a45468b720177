package com.purchasingpower.orchestrator.synthesis;

import java.io.Serializable;

/**
 * @param reliability  share of sources from reliable hosts, lifted by a constant and capped at 1
 * @param completeness how close the source count is to five, capped at 1
 */
public record EvidenceAnalysis(int totalSources, double reliability, double completeness) implements Serializable {

    public static EvidenceAnalysis empty() {
        return new EvidenceAnalysis(0, 0.0, 0.0);
    }
}
