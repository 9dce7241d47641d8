package com.wellnessplatform.common.temporal;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A behaviour pattern found in history.
 * {@code patternType} is one of {@code weekly}, {@code situational}, {@code trigger-based}.
 */
public record RecurringPattern(
    @JsonProperty("patternType") String patternType,
    @JsonProperty("description") String description,
    @JsonProperty("frequency")   double frequency,
    @JsonProperty("confidence")  double confidence,
    @JsonProperty("examples")    List<String> examples
) {
    public RecurringPattern {
        examples = examples != null ? List.copyOf(examples) : List.of();
    }
}
