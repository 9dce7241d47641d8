package com.wellnessplatform.decision.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wellnessplatform.common.model.PlannedTask;
import com.wellnessplatform.common.model.StateSnapshot;

import java.util.List;

public record DecisionRequest(
    @JsonProperty("state") StateSnapshot state,
    @JsonProperty("tasks") List<PlannedTask> tasks
) {}
