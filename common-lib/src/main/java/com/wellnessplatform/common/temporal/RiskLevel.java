package com.wellnessplatform.common.temporal;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RiskLevel {
    LOW, MODERATE, HIGH, CRITICAL;

    static RiskLevel fromPoints(int points) {
        if (points >= 5) return CRITICAL;
        if (points >= 3) return HIGH;
        if (points >= 1) return MODERATE;
        return LOW;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
