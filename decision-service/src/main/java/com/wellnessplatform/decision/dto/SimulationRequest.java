package com.wellnessplatform.decision.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wellnessplatform.common.model.PlannedTask;
import com.wellnessplatform.common.model.StateSnapshot;
import com.wellnessplatform.common.simulation.SimulationScenario;

import java.util.List;

/**
 * Week simulation input. {@code state} defaults to the latest recorded state,
 * {@code dailyHours} to that state's available time, {@code tasks} to the sample plan.
 */
public record SimulationRequest(
    @JsonProperty("scenario")   SimulationScenario scenario,
    @JsonProperty("dailyHours") Double dailyHours,
    @JsonProperty("state")      StateSnapshot state,
    @JsonProperty("tasks")      List<PlannedTask> tasks
) {}
