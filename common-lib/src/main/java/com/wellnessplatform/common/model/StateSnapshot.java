package com.wellnessplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable personal-state snapshot consumed by one decision cycle.
 *
 * <p>Numeric inputs are clamped instead of rejected: negative hours become 0,
 * energy is forced into 1–10 and a missing stress level reads as MEDIUM.
 */
public record StateSnapshot(
    @JsonProperty("sleepHours")                 double sleepHours,
    @JsonProperty("energyLevel")                int energyLevel,
    @JsonProperty("stressLevel")                StressLevel stressLevel,
    @JsonProperty("timeAvailableHours")         double timeAvailableHours,
    @JsonProperty("sleepDebtHours")             double sleepDebtHours,
    @JsonProperty("consecutiveHighEffortDays")  int consecutiveHighEffortDays
) {
    public StateSnapshot {
        sleepHours                = Math.max(0.0, sleepHours);
        energyLevel               = Math.max(1, Math.min(10, energyLevel));
        stressLevel               = stressLevel != null ? stressLevel : StressLevel.MEDIUM;
        timeAvailableHours        = Math.max(0.0, timeAvailableHours);
        sleepDebtHours            = Math.max(0.0, sleepDebtHours);
        consecutiveHighEffortDays = Math.max(0, consecutiveHighEffortDays);
    }

    /** Snapshot without accumulated history (zero sleep debt, zero effort streak). */
    public static StateSnapshot of(double sleepHours, int energyLevel, StressLevel stressLevel,
                                   double timeAvailableHours) {
        return new StateSnapshot(sleepHours, energyLevel, stressLevel, timeAvailableHours, 0.0, 0);
    }
}
