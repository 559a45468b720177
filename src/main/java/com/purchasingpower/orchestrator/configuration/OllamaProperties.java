package com.purchasingpower.orchestrator.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OllamaProperties {

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    @NotBlank
    private String chatModel = "qwen2.5:7b";

    @Min(1)
    private int timeoutSeconds = 120;

    @Min(0)
    private int maxRetries = 2;

    private double responseTemperature = 0.3;

    private boolean logRequests = false;
}
