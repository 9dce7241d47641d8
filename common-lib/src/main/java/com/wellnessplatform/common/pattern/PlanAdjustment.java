package com.wellnessplatform.common.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wellnessplatform.common.model.AdaptationRecord;
import com.wellnessplatform.common.model.PlannedTask;

import java.util.List;

/** Reshaped upcoming tasks plus the audit trail of every change. */
public record PlanAdjustment(
    @JsonProperty("tasks")   List<PlannedTask> tasks,
    @JsonProperty("records") List<AdaptationRecord> records
) {
    public PlanAdjustment {
        tasks   = tasks != null ? List.copyOf(tasks) : List.of();
        records = records != null ? List.copyOf(records) : List.of();
    }
}
