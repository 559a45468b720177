package com.purchasingpower.orchestrator.model;

/**
 * External collaborators whose calls are logged through {@link CallContext}.
 */
public enum ServiceType {
    OLLAMA("🟣", "Ollama"),
    GEMINI("🔴", "Gemini"),
    TOOL("🛠️", "Tool");

    private final String emoji;
    private final String displayName;

    ServiceType(String emoji, String displayName) {
        this.emoji = emoji;
        this.displayName = displayName;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getDisplayName() {
        return displayName;
    }
}
