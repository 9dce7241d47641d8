package com.wellnessplatform.common.temporal;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.DayOfWeek;
import java.util.List;

public record PresentContext(
    @JsonProperty("dayOfWeek")             DayOfWeek dayOfWeek,
    @JsonProperty("timeOfDay")             String timeOfDay,
    @JsonProperty("similarPastSituations") List<SimilarSituation> similarPastSituations,
    @JsonProperty("riskLevel")             RiskLevel riskLevel,
    @JsonProperty("riskFactors")           List<String> riskFactors
) {
    public PresentContext {
        similarPastSituations = similarPastSituations != null ? List.copyOf(similarPastSituations) : List.of();
        riskFactors           = riskFactors != null ? List.copyOf(riskFactors) : List.of();
    }
}
