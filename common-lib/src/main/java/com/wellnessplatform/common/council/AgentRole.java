package com.wellnessplatform.common.council;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Council seats. Declaration order is the canonical vote order used by consensus,
 * so the result never depends on which agent answered first.
 */
public enum AgentRole {
    SLEEP_SPECIALIST("sleep", "Sleep Specialist"),
    PERFORMANCE_COACH("performance", "Performance Coach"),
    WELLNESS_GUARDIAN("wellness", "Wellness Guardian"),
    FUTURE_SELF("future", "Future Self");

    private final String wireName;
    private final String displayName;

    AgentRole(String wireName, String displayName) {
        this.wireName    = wireName;
        this.displayName = displayName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String displayName() {
        return displayName;
    }

    @JsonCreator
    public static AgentRole fromWireName(String value) {
        for (AgentRole r : values()) {
            if (r.wireName.equalsIgnoreCase(value) || r.name().equalsIgnoreCase(value)) {
                return r;
            }
        }
        throw new IllegalArgumentException("Unknown agent role: " + value);
    }
}
