package com.wellnessplatform.common.simulation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wellnessplatform.common.model.StateSnapshot;

import java.util.List;

public record SimulationResult(
    @JsonProperty("scenario")    SimulationScenario scenario,
    @JsonProperty("projections") List<DailyProjection> projections,
    @JsonProperty("finalState")  StateSnapshot finalState,
    @JsonProperty("insights")    List<String> insights,
    @JsonProperty("summary")     WeekSummary summary
) {
    public SimulationResult {
        projections = List.copyOf(projections);
        insights    = List.copyOf(insights);
    }
}
