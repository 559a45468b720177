package com.purchasingpower.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class MultiAgentOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(MultiAgentOrchestratorApplication.class, args);
    }
}
