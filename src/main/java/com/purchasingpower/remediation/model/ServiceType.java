package com.purchasingpower.remediation.model;

/**
 * External services the remediation loop talks to, used to tag call logs.
 *
 * @see com.purchasingpower.remediation.util.ExternalCallLogger
 */
public enum ServiceType {
    OLLAMA("🟣", "Ollama"),
    VORPAL("🛡", "Vorpal");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
