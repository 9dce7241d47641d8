package com.wellnessplatform.common.temporal;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/** A past entry on the same weekday; outcome is {@code skipped} or {@code completed}. */
public record SimilarSituation(
    @JsonProperty("date")    LocalDate date,
    @JsonProperty("outcome") String outcome
) {}
