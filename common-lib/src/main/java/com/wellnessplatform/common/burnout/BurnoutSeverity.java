package com.wellnessplatform.common.burnout;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Risk band derived from the composite burnout score. */
public enum BurnoutSeverity {
    LOW,
    MODERATE,
    HIGH,
    CRITICAL;

    public static BurnoutSeverity fromScore(int riskScore) {
        if (riskScore >= 70) return CRITICAL;
        if (riskScore >= 50) return HIGH;
        if (riskScore >= 30) return MODERATE;
        return LOW;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
