package com.purchasingpower.orchestrator.synthesis;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.util.List;

/**
 * Merged answer built from the specialist responses of one request.
 */
@Value
@Builder
public class ConflictResolution implements Serializable {

    private static final long serialVersionUID = 1L;

    String answer;
    List<String> evidence;
    double confidence;
    ResolutionMethod method;
    double consensusScore;

    /**
     * Domain whose response was used, for single-winner resolutions.
     */
    String winnerDomain;

    int participants;
    int survivors;
    EvidenceAnalysis evidenceAnalysis;
}
