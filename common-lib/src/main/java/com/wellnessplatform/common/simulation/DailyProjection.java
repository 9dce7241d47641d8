package com.wellnessplatform.common.simulation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wellnessplatform.common.model.StateSnapshot;
import com.wellnessplatform.common.model.TradeOffDecision;

import java.time.LocalDate;

/** One simulated day: the projected state, its scores and the engine's decision for it. */
public record DailyProjection(
    @JsonProperty("day")         int day,
    @JsonProperty("date")        LocalDate date,
    @JsonProperty("dayOfWeek")   String dayOfWeek,
    @JsonProperty("state")       StateSnapshot state,
    @JsonProperty("stressLoad")  int stressLoad,
    @JsonProperty("energyScore") int energyScore,
    @JsonProperty("metrics")     DailyMetrics metrics,
    @JsonProperty("decision")    TradeOffDecision decision
) {}
