package com.purchasingpower.orchestrator.workflow.state;

import java.io.Serializable;

/**
 * A failure attributed to the phase (and domain, when known) that produced it.
 *
 * @param reason technical cause; logged, shown to the caller only outside production-safe mode
 */
public record PhaseFailure(String phase, String domain, Kind kind, String reason) implements Serializable {

    public enum Kind {
        TIMEOUT,
        MODEL,
        TOOL,
        NO_RESPONSES,
        CANCELLED,
        INTERNAL
    }

    public static PhaseFailure of(String phase, Kind kind, String reason) {
        return new PhaseFailure(phase, null, kind, reason);
    }
}
