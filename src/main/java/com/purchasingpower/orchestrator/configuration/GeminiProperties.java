package com.purchasingpower.orchestrator.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class GeminiProperties {

    /**
     * Only required when the gemini or hybrid provider is active.
     */
    private String apiKey;

    @NotBlank
    private String chatModel = "gemini-1.5-flash";

    @NotBlank
    private String baseUrl = "https://generativelanguage.googleapis.com";

    @NotBlank
    private String apiVersion = "v1beta";
}
