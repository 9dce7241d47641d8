package com.wellnessplatform.decision.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wellnessplatform.common.model.StateSnapshot;

/** {@code goal} is optional; the stored profile goal is used when it is absent. */
public record CouncilRequest(
    @JsonProperty("state")    StateSnapshot state,
    @JsonProperty("activity") String activity,
    @JsonProperty("goal")     String goal
) {}
