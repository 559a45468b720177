package com.purchasingpower.orchestrator.synthesis;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Rough quality signal over a set of evidence identifiers.
 */
public final class EvidenceAnalyzer {

    private static final List<String> RELIABLE_MARKERS = List.of(".gov", ".edu", ".org", "intra.", "wiki.");
    private static final double RELIABILITY_BASELINE = 0.3;
    private static final double SOURCES_FOR_COMPLETE = 5.0;

    private EvidenceAnalyzer() {
    }

    public static EvidenceAnalysis analyze(Collection<String> evidence) {
        if (evidence == null || evidence.isEmpty()) {
            return EvidenceAnalysis.empty();
        }
        int total = evidence.size();
        long reliable = evidence.stream().filter(EvidenceAnalyzer::isReliable).count();
        double reliability = Math.min(1.0, (double) reliable / total + RELIABILITY_BASELINE);
        double completeness = Math.min(1.0, total / SOURCES_FOR_COMPLETE);
        return new EvidenceAnalysis(total, reliability, completeness);
    }

    static boolean isReliable(String source) {
        String lower = source.toLowerCase(Locale.ROOT);
        return RELIABLE_MARKERS.stream().anyMatch(lower::contains);
    }
}
