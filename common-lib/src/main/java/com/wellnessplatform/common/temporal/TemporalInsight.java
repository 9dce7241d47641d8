package com.wellnessplatform.common.temporal;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Past patterns, present risk and projected trajectories for one state snapshot.
 * {@code urgencyLevel} runs from 1 (nothing to do) to 5 (rest now).
 */
public record TemporalInsight(
    @JsonProperty("pastPatterns")       List<RecurringPattern> pastPatterns,
    @JsonProperty("presentContext")     PresentContext presentContext,
    @JsonProperty("futureTrajectories") List<FutureTrajectory> futureTrajectories,
    @JsonProperty("recommendation")     String recommendation,
    @JsonProperty("urgencyLevel")       int urgencyLevel
) {
    public TemporalInsight {
        pastPatterns       = pastPatterns != null ? List.copyOf(pastPatterns) : List.of();
        futureTrajectories = futureTrajectories != null ? List.copyOf(futureTrajectories) : List.of();
        urgencyLevel       = Math.max(1, Math.min(5, urgencyLevel));
    }
}
