package com.wellnessplatform.decision.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wellnessplatform.common.model.TradeOffDecision;

/** A decision plus the two human-readable views of it. */
public record DecisionResponse(
    @JsonProperty("decision")          TradeOffDecision decision,
    @JsonProperty("constraintSummary") String constraintSummary,
    @JsonProperty("narrative")         String narrative
) {}
