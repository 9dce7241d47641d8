package com.wellnessplatform.decision.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wellnessplatform.common.model.PlannedTask;

import java.util.List;

/** Upcoming tasks to reshape against the latest stored decision and the history. */
public record PlanAdjustRequest(
    @JsonProperty("upcomingTasks") List<PlannedTask> upcomingTasks
) {}
