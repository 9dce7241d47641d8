package com.wellnessplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed constraint vocabulary. Each entry carries its snake_case wire name and the
 * default human description used when the evaluator has nothing more specific to say.
 */
public enum ConstraintType {
    LOW_SLEEP("low_sleep", "Sleep below minimum threshold - recovery impaired"),
    CRITICAL_SLEEP("critical_sleep", "Severely sleep deprived - high priority for rest"),
    SLEEP_DEBT_ACCUMULATED("sleep_debt_accumulated", "Accumulated sleep debt needs addressing"),
    LOW_ENERGY("low_energy", "Energy levels depleted - reduced capacity for effort"),
    CRITICAL_ENERGY("critical_energy", "Energy critically low - only essential activities"),
    HIGH_STRESS("high_stress", "Elevated stress - cognitive load impaired"),
    TIME_LIMITED("time_limited", "Limited time available - must prioritize"),
    TIME_CRITICAL("time_critical", "Minimal time available - only most critical tasks"),
    OVERTRAINING_RISK("overtraining_risk", "Too many consecutive high-effort days"),
    BURNOUT_WARNING("burnout_warning", "Multiple indicators suggest burnout risk");

    private final String wireName;
    private final String defaultDescription;

    ConstraintType(String wireName, String defaultDescription) {
        this.wireName = wireName;
        this.defaultDescription = defaultDescription;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String defaultDescription() {
        return defaultDescription;
    }

    public boolean isSleepRelated() {
        return this == LOW_SLEEP || this == CRITICAL_SLEEP;
    }

    public boolean isEnergyRelated() {
        return this == LOW_ENERGY || this == CRITICAL_ENERGY;
    }

    @JsonCreator
    public static ConstraintType fromWireName(String value) {
        for (ConstraintType t : values()) {
            if (t.wireName.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown constraint: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
