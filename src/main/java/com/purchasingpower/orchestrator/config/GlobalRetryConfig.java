package com.purchasingpower.orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Retry and backoff settings shared by outbound model calls and the parameter repair loop.
 *
 * <p>Properties are loaded from the {@code app.retry} namespace in application.yml:
 * <pre>
 * app:
 *   retry:
 *     max-attempts: 3
 *     backoff-ms: 500
 *     max-backoff-ms: 4000
 *     multiplier: 2.0
 *     retryable-status-codes: [429, 500, 502, 503, 504]
 * </pre>
 *
 * <p><b>Exponential Backoff Calculation:</b>
 * For retry N (starting at 0), the delay is:
 * <pre>
 *   delay = min(backoff-ms * (multiplier ^ N), max-backoff-ms)
 * </pre>
 */
@ConfigurationProperties(prefix = "app.retry")
@Data
public class GlobalRetryConfig {

    /**
     * Retries of a transient HTTP failure against a model provider.
     * Default: 3
     */
    private int maxAttempts = 3;

    /**
     * Delay before the first retry, in milliseconds.
     * Default: 500
     */
    private long backoffMs = 500;

    /**
     * Upper bound for any single delay, in milliseconds.
     * Default: 4000
     */
    private long maxBackoffMs = 4000;

    /**
     * Growth factor applied per retry.
     * Default: 2.0
     */
    private double multiplier = 2.0;

    /**
     * HTTP status codes worth retrying. Anything else fails immediately.
     */
    private List<Integer> retryableStatusCodes = List.of(429, 500, 502, 503, 504);

    /**
     * Delay to wait before retry number {@code retry} (0-based).
     */
    public Duration backoffFor(int retry) {
        if (backoffMs <= 0) {
            return Duration.ZERO;
        }
        double delay = backoffMs * Math.pow(multiplier <= 0 ? 1.0 : multiplier, Math.max(0, retry));
        long capped = (long) Math.min(delay, Math.max(backoffMs, maxBackoffMs));
        return Duration.ofMillis(capped);
    }

    public Duration initialBackoff() {
        return Duration.ofMillis(Math.max(0, backoffMs));
    }

    public Duration maxBackoff() {
        return Duration.ofMillis(Math.max(backoffMs, maxBackoffMs));
    }
}
