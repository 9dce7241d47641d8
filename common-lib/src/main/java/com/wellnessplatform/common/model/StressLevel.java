package com.wellnessplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Self-reported or wearable-derived stress band.
 * {@link #code()} is the numeric encoding used by rolling risk scores (LOW=1, MEDIUM=2, HIGH=3).
 */
public enum StressLevel {
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private final int code;

    StressLevel(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** Accepts any casing and the legacy {@code "moderate"} spelling. */
    @JsonCreator
    public static StressLevel fromString(String value) {
        if (value == null || value.isBlank()) return MEDIUM;
        String v = value.trim().toUpperCase();
        if ("MODERATE".equals(v)) return MEDIUM;
        return StressLevel.valueOf(v);
    }
}
