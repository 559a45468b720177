package com.purchasingpower.orchestrator.synthesis;

public enum ResolutionMethod {
    /**
     * One response was used as is.
     */
    SINGLE_WINNER,
    /**
     * Several responses merged by the model, higher confidence evidence preferred.
     */
    EVIDENCE_WEIGHTED_MERGE,
    /**
     * No usable response; the caller gets a fixed failure answer.
     */
    ESCALATION
}
