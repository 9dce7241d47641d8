package com.wellnessplatform.decision.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthStatusDTO(
    @JsonProperty("status")         String status,
    @JsonProperty("historySize")    int historySize,
    @JsonProperty("maxHistorySize") int maxHistorySize,
    @JsonProperty("narrativeMode")  String narrativeMode
) {}
