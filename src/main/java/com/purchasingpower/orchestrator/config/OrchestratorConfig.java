package com.purchasingpower.orchestrator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tunables of the orchestration workflow, bound from {@code app.orchestrator}.
 *
 * <p>Every phase has its own timeout; a timeout is handled exactly like a phase failure.
 */
@ConfigurationProperties(prefix = "app.orchestrator")
@Validated
@Data
public class OrchestratorConfig {

    @Valid
    private Selection selection = new Selection();

    @Valid
    private Parameters parameters = new Parameters();

    @Valid
    private Timeouts timeouts = new Timeouts();

    @Valid
    private Synthesis synthesis = new Synthesis();

    @Valid
    private FinalResponse finalResponse = new FinalResponse();

    @Valid
    private History history = new History();

    /**
     * When true, technical failure causes never reach the caller.
     */
    private boolean productionSafeErrors = true;

    private String defaultLanguage = "en";

    @Data
    public static class Selection {

        @Min(1)
        private int maxAgentsPerQuery = 3;

        /**
         * Reported complexity at or below which a multi-domain answer is narrowed to one domain.
         * Empirical default.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double singleAgentComplexityThreshold = 0.8;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double fallbackConfidence = 0.4;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double fallbackComplexity = 0.5;

        @Min(5)
        private int defaultEstimatedDurationSeconds = 30;
    }

    @Data
    public static class Parameters {

        /**
         * Repair attempts after the first extraction of a tool call.
         */
        @Min(0)
        private int maxRetries = 2;
    }

    @Data
    public static class Timeouts {

        @NotNull
        private Duration semanticReflection = Duration.ofSeconds(30);

        @NotNull
        private Duration executePlanning = Duration.ofSeconds(90);

        @NotNull
        private Duration conflictResolution = Duration.ofSeconds(45);

        @NotNull
        private Duration finalResponse = Duration.ofSeconds(90);

        /**
         * Per call budget handed to the language-model provider.
         */
        @NotNull
        private Duration modelCall = Duration.ofSeconds(60);

        /**
         * Upper bound for a whole request: every phase at its limit plus one grace period.
         */
        public Duration total() {
            return semanticReflection.plus(executePlanning).plus(conflictResolution)
                    .plus(finalResponse).plus(modelCall);
        }
    }

    @Data
    public static class Synthesis {

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double confidenceCap = 0.95;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double allFailedConfidence = 0.1;
    }

    @Data
    public static class FinalResponse {

        /**
         * Rephrase the synthesized content with a streaming model call.
         * When false the content is emitted as a single fragment.
         */
        private boolean phraseAnswer = true;

        private boolean followUpsEnabled = true;

        @Min(0)
        private int maxFollowUps = 3;
    }

    @Data
    public static class History {

        @Min(0)
        private int maxTurns = 10;
    }
}
