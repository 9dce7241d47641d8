package com.wellnessplatform.common.constraint;

/**
 * Configurable cut-offs for constraint detection.
 *
 * <p>Defaults:
 * <pre>
 *   minSleepHours             6.0     criticalSleepHours        5.0
 *   lowEnergyThreshold        4       criticalEnergyThreshold   2
 *   minTimeHours              0.5     limitedTimeHours          1.5
 *   maxConsecutiveHighEffort  3
 *   sleepDebtWarningHours     3.0     sleepDebtCriticalHours    6.0
 * </pre>
 */
public record ConstraintThresholds(
    double minSleepHours,
    double criticalSleepHours,
    int lowEnergyThreshold,
    int criticalEnergyThreshold,
    double minTimeHours,
    double limitedTimeHours,
    int maxConsecutiveHighEffort,
    double sleepDebtWarningHours,
    double sleepDebtCriticalHours
) {
    public static ConstraintThresholds defaults() {
        return new ConstraintThresholds(6.0, 5.0, 4, 2, 0.5, 1.5, 3, 3.0, 6.0);
    }
}
