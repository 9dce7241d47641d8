package com.wellnessplatform.common.priority;

import com.wellnessplatform.common.model.Category;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of {@link PriorityMatrix#calculate}: the normalized per-category distribution
 * plus an ordered trace of every (category, constraint) contribution.
 *
 * <p>Trace keys are {@code <category>_<constraint>} and values read like
 * {@code "+0.23 (critical_sleep)"}.
 */
public record PriorityResult(
    Map<Category, Double> priorities,
    Map<String, String> adjustments
) {
    public PriorityResult {
        priorities  = Collections.unmodifiableMap(new EnumMap<>(priorities));
        adjustments = Collections.unmodifiableMap(new LinkedHashMap<>(adjustments));
    }

    public double priorityOf(Category category) {
        return priorities.getOrDefault(category, 0.0);
    }
}
