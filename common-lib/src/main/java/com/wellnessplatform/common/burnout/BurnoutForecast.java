package com.wellnessplatform.common.burnout;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Burnout risk forecast.
 * {@code daysToCrisis} is {@code null} below the moderate band; {@code primaryFactors}
 * is never empty.
 */
public record BurnoutForecast(
    @JsonProperty("riskScore")          int riskScore,
    @JsonProperty("daysToCrisis")       Integer daysToCrisis,
    @JsonProperty("primaryFactors")     List<String> primaryFactors,
    @JsonProperty("interventionNeeded") boolean interventionNeeded,
    @JsonProperty("severity")           BurnoutSeverity severity
) {
    public BurnoutForecast {
        riskScore      = Math.max(0, Math.min(100, riskScore));
        primaryFactors = primaryFactors != null && !primaryFactors.isEmpty()
            ? List.copyOf(primaryFactors)
            : List.of("No significant risk factors");
    }
}
