package com.wellnessplatform.decision.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wellnessplatform.common.model.StateSnapshot;

public record TemporalRequest(
    @JsonProperty("state") StateSnapshot state
) {}
