package com.wellnessplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Minimal user profile: identity, stated goal and per-category preferences.
 */
public record UserProfile(
    @JsonProperty("userId")      String userId,
    @JsonProperty("name")        String name,
    @JsonProperty("goal")        String goal,
    @JsonProperty("preferences") DomainPreferences preferences
) {
    public UserProfile {
        preferences = preferences != null ? preferences : DomainPreferences.balanced();
        goal        = goal != null ? goal : "Improve overall health";
    }

    public static UserProfile defaultProfile() {
        return new UserProfile("default", "Demo User", "Improve overall health", DomainPreferences.balanced());
    }
}
