package com.wellnessplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single named limiting condition. Severity is clamped to [0.0, 1.0].
 *
 * <p>{@code source} is one of {@code wearable}, {@code derived} or {@code user_input}.
 */
public record Constraint(
    @JsonProperty("type")        ConstraintType type,
    @JsonProperty("severity")    double severity,
    @JsonProperty("description") String description,
    @JsonProperty("source")      String source
) {
    public static final String SOURCE_WEARABLE   = "wearable";
    public static final String SOURCE_DERIVED    = "derived";
    public static final String SOURCE_USER_INPUT = "user_input";

    public Constraint {
        severity = Math.max(0.0, Math.min(1.0, severity));
        if (description == null && type != null) {
            description = type.defaultDescription();
        }
    }
}
