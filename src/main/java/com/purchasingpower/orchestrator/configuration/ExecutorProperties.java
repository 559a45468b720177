package com.purchasingpower.orchestrator.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Thread pool sizing, bound from {@code app.executors}.
 *
 * Requests, phase bodies and specialist units run on separate pools so a saturated
 * fan-out can never starve the phase that is waiting on it.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.executors")
public class ExecutorProperties {

    private Pool workflow = new Pool(4, 16, 100);
    private Pool phase = new Pool(4, 32, 0);
    private Pool specialist = new Pool(8, 48, 0);

    @Data
    public static class Pool {
        @Min(1)
        private int corePoolSize;
        @Min(1)
        private int maxPoolSize;
        @Min(0)
        private int queueCapacity;

        public Pool() {
        }

        public Pool(int corePoolSize, int maxPoolSize, int queueCapacity) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
        }
    }
}
