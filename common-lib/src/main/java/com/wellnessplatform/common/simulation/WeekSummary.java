package com.wellnessplatform.common.simulation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wellnessplatform.common.model.Category;
import com.wellnessplatform.common.model.ConstraintType;
import com.wellnessplatform.common.model.DecisionAction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregates over a simulated week. {@code constraintFrequency} keeps the five most
 * frequent constraints, most frequent first.
 */
public record WeekSummary(
    @JsonProperty("daysSimulated")       int daysSimulated,
    @JsonProperty("totalDecisions")      int totalDecisions,
    @JsonProperty("actionBreakdown")     Map<DecisionAction, Integer> actionBreakdown,
    @JsonProperty("categoryBreakdown")   Map<Category, Map<DecisionAction, Integer>> categoryBreakdown,
    @JsonProperty("constraintFrequency") Map<ConstraintType, Integer> constraintFrequency,
    @JsonProperty("averageSleep")        double averageSleep,
    @JsonProperty("burnoutDays")         int burnoutDays
) {
    public WeekSummary {
        actionBreakdown     = Collections.unmodifiableMap(new LinkedHashMap<>(actionBreakdown));
        categoryBreakdown   = Collections.unmodifiableMap(new LinkedHashMap<>(categoryBreakdown));
        constraintFrequency = Collections.unmodifiableMap(new LinkedHashMap<>(constraintFrequency));
    }
}
