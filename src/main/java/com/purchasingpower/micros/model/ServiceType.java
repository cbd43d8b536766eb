package com.purchasingpower.micros.model;

/**
 * External call categories for unified logging.
 *
 * @see com.purchasingpower.micros.util.ExternalCallLogger
 */
public enum ServiceType {
    LLM("🧠", "LLM"),
    TOOL("🔧", "Tool");

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
