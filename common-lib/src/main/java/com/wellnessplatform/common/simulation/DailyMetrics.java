package com.wellnessplatform.common.simulation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wellnessplatform.common.model.StateSnapshot;

/**
 * Point-in-time scores for one simulated day, all on a 0-100 scale.
 *
 * <pre>
 *   sleepScore  = min(100, sleep / 8 × 100), minus 10 above 9h
 *   readiness   = energy × 10 × 0.4 + sleepScore × 0.4 − stressPenalty + 20
 *   burnoutRisk = stressWeight + (10 − energy) × 3 + max(0, 8 − sleep) × 5
 * </pre>
 * Stress penalty / weight: HIGH 30 / 50, MEDIUM 10 / 20, LOW 0 / 0.
 */
public record DailyMetrics(
    @JsonProperty("readinessScore")       int readinessScore,
    @JsonProperty("sleepScore")           int sleepScore,
    @JsonProperty("burnoutRiskScore")     int burnoutRiskScore,
    @JsonProperty("burnoutRiskLabel")     String burnoutRiskLabel,
    @JsonProperty("burnoutPrimaryFactor") String burnoutPrimaryFactor
) {
    static final double IDEAL_SLEEP_HOURS      = 8.0;
    static final int    MIN_HISTORY_FOR_FACTOR = 5;

    public static DailyMetrics of(StateSnapshot state, int historyCount) {
        int sleepScore = Math.min(100, (int) (state.sleepHours() / IDEAL_SLEEP_HOURS * 100));
        if (state.sleepHours() > 9.0) sleepScore -= 10;

        int stressPenalty;
        int stressWeight;
        switch (state.stressLevel()) {
            case HIGH -> { stressPenalty = 30; stressWeight = 50; }
            case MEDIUM -> { stressPenalty = 10; stressWeight = 20; }
            default -> { stressPenalty = 0; stressWeight = 0; }
        }

        int readiness = (int) (state.energyLevel() * 10 * 0.4 + sleepScore * 0.4 - stressPenalty);
        readiness = clamp(readiness + 20);

        int inverseEnergy = (10 - state.energyLevel()) * 3;
        double inverseSleep = Math.max(0.0, (IDEAL_SLEEP_HOURS - state.sleepHours()) * 5);
        int burnoutRisk = clamp((int) (stressWeight + inverseEnergy + inverseSleep));

        return new DailyMetrics(readiness, sleepScore, burnoutRisk, riskLabel(burnoutRisk),
            primaryFactor(historyCount, stressWeight, inverseEnergy, inverseSleep));
    }

    private static String riskLabel(int risk) {
        if (risk > 70) return "High Risk";
        if (risk > 40) return "Medium Risk";
        return "Low Risk";
    }

    private static String primaryFactor(int historyCount, double stress, double energy, double sleep) {
        if (historyCount < MIN_HISTORY_FOR_FACTOR) return "Insufficient data (need 5+ sessions)";

        String factor = "High stress load";
        double max = stress;
        if (energy > max) { factor = "Low energy reserves"; max = energy; }
        if (sleep > max)  { factor = "Sleep debt";          max = sleep; }
        return max < 10 ? "None (stable)" : factor;
    }

    private static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }
}
