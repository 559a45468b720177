package com.purchasingpower.orchestrator.model;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One outbound call (model provider or tool) being logged.
 *
 * Emits a request line, then either a response line or an error line, all tagged with a
 * short call id and the owning request id so interleaved calls from parallel specialists
 * stay readable.
 *
 * @see com.purchasingpower.orchestrator.util.ExternalCallLogger
 */
public class CallContext {

    private final String callId;
    private final String requestId;
    private final ServiceType service;
    private final String operation;
    private final Instant startTime;
    private final Logger logger;

    public CallContext(ServiceType service, String operation, String requestId, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.requestId = requestId == null ? "-" : requestId;
        this.service = service;
        this.operation = operation;
        this.startTime = Instant.now();
        this.logger = logger;
    }

    public void logRequest(Object... details) {
        logger.info("{} {} → {} [call={}, request={}]",
                service.getEmoji(), service.getDisplayName(), operation, callId, requestId);
        logDetails("  →", details);
    }

    public void logResponse(Object... details) {
        logger.info("{} {} ← {} [call={}, request={}] ({}ms)",
                service.getEmoji(), service.getDisplayName(), operation, callId, requestId, getElapsedMs());
        logDetails("  ←", details);
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} {} ✖ {} [call={}, request={}] ({}ms) - {}",
                service.getEmoji(), service.getDisplayName(), operation, callId, requestId,
                getElapsedMs(), errorMessage);
        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    // details come in key/value pairs
    private void logDetails(String marker, Object... details) {
        if (details == null || !logger.isDebugEnabled()) {
            return;
        }
        for (int i = 0; i + 1 < details.length; i += 2) {
            logger.debug("{} {}: {}", marker, details[i], details[i + 1]);
        }
    }

    public String getCallId() {
        return callId;
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }
}
