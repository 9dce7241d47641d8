package com.wellnessplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Audit record of a pattern-driven plan change.
 */
public record AdaptationRecord(
    @JsonProperty("timestamp")          Instant timestamp,
    @JsonProperty("patternDetected")    String patternDetected,
    @JsonProperty("adaptationMade")     String adaptationMade,
    @JsonProperty("affectedCategories") List<Category> affectedCategories,
    @JsonProperty("reasoning")          String reasoning
) {
    public AdaptationRecord {
        affectedCategories = affectedCategories != null ? List.copyOf(affectedCategories) : List.of();
    }
}
