package com.wellnessplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A task originally planned for one category.
 * Duration is clamped to at least one minute and intensity to [0.0, 1.0].
 */
public record PlannedTask(
    @JsonProperty("category")        Category category,
    @JsonProperty("name")            String name,
    @JsonProperty("durationMinutes") int durationMinutes,
    @JsonProperty("intensity")       double intensity,
    @JsonProperty("description")     String description
) {
    public PlannedTask {
        durationMinutes = Math.max(1, durationMinutes);
        intensity       = Math.max(0.0, Math.min(1.0, intensity));
        description     = description != null ? description : "";
    }

    public PlannedTask withDurationAndIntensity(String newName, int newDuration, double newIntensity,
                                                String newDescription) {
        return new PlannedTask(category, newName, newDuration, newIntensity, newDescription);
    }
}
