package com.wellnessplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumMap;
import java.util.Map;

/**
 * User-declared weight per category, each in [0.0, 1.0].
 * Blended into the priority matrix at a fixed 30% share.
 */
public record DomainPreferences(
    @JsonProperty("fitness")     double fitness,
    @JsonProperty("nutrition")   double nutrition,
    @JsonProperty("recovery")    double recovery,
    @JsonProperty("mindfulness") double mindfulness
) {
    public DomainPreferences {
        fitness     = clamp(fitness);
        nutrition   = clamp(nutrition);
        recovery    = clamp(recovery);
        mindfulness = clamp(mindfulness);
    }

    /** Equal 0.25 split, the default profile preference. */
    public static DomainPreferences balanced() {
        return new DomainPreferences(0.25, 0.25, 0.25, 0.25);
    }

    public double valueFor(Category category) {
        return switch (category) {
            case FITNESS     -> fitness;
            case NUTRITION   -> nutrition;
            case RECOVERY    -> recovery;
            case MINDFULNESS -> mindfulness;
        };
    }

    @JsonIgnore
    public Map<Category, Double> asMap() {
        Map<Category, Double> map = new EnumMap<>(Category.class);
        for (Category c : Category.values()) {
            map.put(c, valueFor(c));
        }
        return map;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
