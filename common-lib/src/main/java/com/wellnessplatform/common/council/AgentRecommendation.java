package com.wellnessplatform.common.council;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One agent's vote.
 *
 * <p>{@code priorityHints} maps an activity area (e.g. {@code "Sleep"}, {@code "Exercise"})
 * to a suggested priority multiplier. Informational only; consensus ignores it.
 */
public record AgentRecommendation(
    @JsonProperty("role")          AgentRole role,
    @JsonProperty("action")        CouncilAction action,
    @JsonProperty("reasoning")     String reasoning,
    @JsonProperty("confidence")    double confidence,
    @JsonProperty("priorityHints") Map<String, Double> priorityHints
) {
    public AgentRecommendation {
        confidence    = Math.max(0.0, Math.min(1.0, confidence));
        priorityHints = priorityHints != null ? Map.copyOf(priorityHints) : Map.of();
        reasoning     = reasoning != null ? reasoning : "";
    }

    /**
     * Zero-confidence PROCEED used when an agent fails. It keeps the seat filled
     * without moving any action's weighted total.
     */
    public static AgentRecommendation abstain(AgentRole role, String reason) {
        return new AgentRecommendation(role, CouncilAction.PROCEED,
            "Agent unavailable: " + reason, 0.0, Map.of());
    }
}
