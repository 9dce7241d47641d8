package com.wellnessplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Complete output of one trade-off cycle, with its full reasoning trail.
 *
 * <p>Created once per cycle and immutable afterwards: every collection is copied on
 * construction. Collaborators append it to a bounded, time-ordered history log.
 */
public record TradeOffDecision(
    @JsonProperty("decisionId")          String decisionId,
    @JsonProperty("timestamp")           Instant timestamp,
    @JsonProperty("stateSnapshot")       StateSnapshot stateSnapshot,
    @JsonProperty("constraintsActive")   List<ConstraintType> constraintsActive,
    @JsonProperty("priorityAdjustments") Map<String, String> priorityAdjustments,
    @JsonProperty("decisions")           List<DomainDecision> decisions,
    @JsonProperty("futureImpacts")       List<FutureImpact> futureImpacts,
    @JsonProperty("confidenceScore")     double confidenceScore,
    @JsonProperty("reasoningSummary")    String reasoningSummary
) {
    public TradeOffDecision {
        constraintsActive   = constraintsActive != null ? List.copyOf(constraintsActive) : List.of();
        priorityAdjustments = priorityAdjustments != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(priorityAdjustments))
            : Map.of();
        decisions           = decisions != null ? List.copyOf(decisions) : List.of();
        futureImpacts       = futureImpacts != null ? List.copyOf(futureImpacts) : List.of();
        confidenceScore     = Math.max(0.0, Math.min(1.0, confidenceScore));
    }

    /** The decision taken for {@code category}, if that category had a planned task. */
    public Optional<DomainDecision> decisionFor(Category category) {
        return decisions.stream()
            .filter(d -> d.category() == category)
            .findFirst();
    }

    @JsonIgnore
    public boolean hasSkip() {
        return decisions.stream().anyMatch(d -> d.action() == DecisionAction.SKIP);
    }

    public boolean hasConstraint(ConstraintType type) {
        return constraintsActive.contains(type);
    }
}
