package com.wellnessplatform.common.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Per-weekday aggregate over the decision history. Reporting only. */
public record DayOfWeekStats(
    @JsonProperty("decisions")      int decisions,
    @JsonProperty("constraints")    int constraints,
    @JsonProperty("skips")          int skips,
    @JsonProperty("avgConstraints") double avgConstraints,
    @JsonProperty("skipRate")       double skipRate
) {
    static DayOfWeekStats of(int decisions, int constraints, int skips) {
        double avg  = decisions > 0 ? (double) constraints / decisions : 0.0;
        double rate = decisions > 0 ? (double) skips / decisions : 0.0;
        return new DayOfWeekStats(decisions, constraints, skips, avg, rate);
    }
}
