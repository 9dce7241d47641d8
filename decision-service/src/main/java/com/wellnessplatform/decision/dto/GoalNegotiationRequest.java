package com.wellnessplatform.decision.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record GoalNegotiationRequest(
    @JsonProperty("goal") String goal
) {}
