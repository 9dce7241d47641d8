package com.wellnessplatform.common.temporal;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Projected outcome on the current path. {@code timeline}: 24h, 1 week or 1 month. */
public record FutureTrajectory(
    @JsonProperty("timeline")           String timeline,
    @JsonProperty("predictedOutcome")   String predictedOutcome,
    @JsonProperty("probability")        double probability,
    @JsonProperty("impactLevel")        ImpactLevel impactLevel,
    @JsonProperty("interventionWindow") String interventionWindow
) {}
