package com.wellnessplatform.decision.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ErrorResponse(
    @JsonProperty("status")    int status,
    @JsonProperty("error")     String error,
    @JsonProperty("message")   String message,
    @JsonProperty("timestamp") Instant timestamp
) {}
