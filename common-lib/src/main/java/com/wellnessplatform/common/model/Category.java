package com.wellnessplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The closed set of life domains every decision cycle covers.
 * Serialized as the lower-case wire name ({@code "fitness"}, ...).
 */
public enum Category {
    FITNESS("fitness"),
    NUTRITION("nutrition"),
    RECOVERY("recovery"),
    MINDFULNESS("mindfulness");

    private final String wireName;

    Category(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Category fromWireName(String value) {
        if (value == null) return null;
        for (Category c : values()) {
            if (c.wireName.equalsIgnoreCase(value) || c.name().equalsIgnoreCase(value)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown category: " + value);
    }
}
