package com.purchasingpower.orchestrator.util;

import com.purchasingpower.orchestrator.model.CallContext;
import com.purchasingpower.orchestrator.model.ServiceType;
import org.slf4j.Logger;

/**
 * Entry point for structured logging of outbound calls.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, String requestId, Logger logger) {
        return new CallContext(service, operation, requestId, logger);
    }

    /**
     * Truncate large strings so prompts and completions do not flood the log.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }
}
