package com.wellnessplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Decision for a single category.
 * A {@link DecisionAction#DOWNGRADE} always carries the replacement task; every other
 * action carries {@code null}.
 */
public record DomainDecision(
    @JsonProperty("category")      Category category,
    @JsonProperty("action")        DecisionAction action,
    @JsonProperty("originalTask")  PlannedTask originalTask,
    @JsonProperty("adjustedTask")  PlannedTask adjustedTask,
    @JsonProperty("reasoning")     String reasoning,
    @JsonProperty("priorityScore") double priorityScore
) {
    public DomainDecision {
        if (action == DecisionAction.DOWNGRADE && adjustedTask == null) {
            throw new IllegalArgumentException("DOWNGRADE decision for " + category + " requires an adjusted task");
        }
        if (action != DecisionAction.DOWNGRADE) {
            adjustedTask = null;
        }
    }
}
