package com.wellnessplatform.common.temporal;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Projected impact of a trajectory, ordered by increasing weight. */
public enum ImpactLevel {
    MINOR, MODERATE, MAJOR, SEVERE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
