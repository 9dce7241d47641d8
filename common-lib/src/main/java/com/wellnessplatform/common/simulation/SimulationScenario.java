package com.wellnessplatform.common.simulation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.wellnessplatform.common.model.StateSnapshot;
import com.wellnessplatform.common.model.StressLevel;

/**
 * Starting condition for a simulated week, applied once to the current state.
 */
public enum SimulationScenario {
    /** High stress and two points less energy. */
    BURNOUT_RECOVERY("burnout_recovery"),
    /** Medium stress, energy unchanged. */
    PREVENTIVE("preventive"),
    /** Low stress and two points more energy. */
    PEAK("peak");

    private final String wireName;

    SimulationScenario(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static SimulationScenario fromWireName(String value) {
        if (value == null) return null;
        for (SimulationScenario s : values()) {
            if (s.wireName.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown scenario: " + value);
    }

    StateSnapshot applyTo(StateSnapshot state, double dailyHours) {
        StressLevel stress = state.stressLevel();
        int energy = state.energyLevel();
        switch (this) {
            case BURNOUT_RECOVERY -> {
                stress = StressLevel.HIGH;
                energy = energy - 2;
            }
            case PREVENTIVE -> stress = StressLevel.MEDIUM;
            case PEAK -> {
                stress = StressLevel.LOW;
                energy = energy + 2;
            }
        }
        return new StateSnapshot(state.sleepHours(), energy, stress, dailyHours,
            state.sleepDebtHours(), state.consecutiveHighEffortDays());
    }
}
