package com.wellnessplatform.common.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wellnessplatform.common.model.Category;
import com.wellnessplatform.common.model.ConstraintType;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weekly adjustment report. With {@link Status#INSUFFICIENT_DATA} every aggregate is empty.
 */
public record PatternReport(
    @JsonProperty("status")              Status status,
    @JsonProperty("period")              String period,
    @JsonProperty("totalDecisions")      int totalDecisions,
    @JsonProperty("categories")          Map<Category, CategoryRates> categories,
    @JsonProperty("constraintFrequency") Map<ConstraintType, Integer> constraintFrequency,
    @JsonProperty("dayPatterns")         Map<DayOfWeek, DayOfWeekStats> dayPatterns,
    @JsonProperty("adaptationsMade")     int adaptationsMade,
    @JsonProperty("recommendations")     List<String> recommendations
) {
    public enum Status { OK, INSUFFICIENT_DATA }

    public PatternReport {
        categories          = categories != null && !categories.isEmpty()
            ? Collections.unmodifiableMap(new EnumMap<>(categories)) : Map.of();
        constraintFrequency = constraintFrequency != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(constraintFrequency)) : Map.of();
        dayPatterns         = dayPatterns != null && !dayPatterns.isEmpty()
            ? Collections.unmodifiableMap(new EnumMap<>(dayPatterns)) : Map.of();
        recommendations     = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    public static PatternReport insufficientData(int totalDecisions) {
        return new PatternReport(Status.INSUFFICIENT_DATA, null, totalDecisions,
            Map.of(), Map.of(), Map.of(), 0, List.of());
    }
}
