package com.wellnessplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Forward-looking note attached to a decision. Not an executed mutation; the plan
 * adjuster reads {@code adjustmentType} when reshaping upcoming tasks.
 */
public record FutureImpact(
    @JsonProperty("daysAffected")   int daysAffected,
    @JsonProperty("adjustmentType") String adjustmentType,
    @JsonProperty("description")    String description
) {
    public static final String INTENSITY_REDUCTION = "intensity_reduction";
    public static final String WORKOUT_RESCHEDULE  = "workout_reschedule";
    public static final String SLEEP_EXTENSION     = "sleep_extension";
    public static final String DELOAD_WEEK         = "deload_week";

    public FutureImpact {
        daysAffected = Math.max(1, daysAffected);
    }
}
