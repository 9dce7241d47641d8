package com.wellnessplatform.common.constraint;

import com.wellnessplatform.common.model.ActiveConstraints;
import com.wellnessplatform.common.model.Constraint;
import com.wellnessplatform.common.model.ConstraintType;
import com.wellnessplatform.common.model.StateSnapshot;
import com.wellnessplatform.common.model.StressLevel;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Maps a {@link StateSnapshot} to the set of constraints limiting full adherence today.
 *
 * <h3>Rule order</h3>
 * <ol>
 *   <li>Sleep: critical below {@code criticalSleepHours}, otherwise low below {@code minSleepHours}</li>
 *   <li>Sleep debt: warning / critical accumulated hours</li>
 *   <li>Energy: critical at or below {@code criticalEnergyThreshold}, otherwise low</li>
 *   <li>Stress: HIGH only</li>
 *   <li>Time: critical below {@code minTimeHours}, otherwise limited</li>
 *   <li>Effort: consecutive high-effort streak</li>
 *   <li>Compound {@code burnout_warning}: derived last from the constraints above</li>
 * </ol>
 *
 * <p>Stateless and deterministic; never throws for in-domain input.
 */
public class ConstraintEvaluator {

    static final double CRITICAL_SEVERITY       = 0.9;
    static final double GRADED_SEVERITY_CAP     = 0.7;
    static final double DEBT_CRITICAL_SEVERITY  = 0.8;
    static final double DEBT_WARNING_SEVERITY   = 0.5;
    static final double HIGH_STRESS_SEVERITY    = 0.7;
    static final double OVERTRAINING_SEVERITY   = 0.6;
    static final double BURNOUT_SEVERITY        = 0.85;
    static final int    BURNOUT_FACTOR_MINIMUM  = 3;

    private final ConstraintThresholds thresholds;

    public ConstraintEvaluator() {
        this(ConstraintThresholds.defaults());
    }

    public ConstraintEvaluator(ConstraintThresholds thresholds) {
        this.thresholds = thresholds != null ? thresholds : ConstraintThresholds.defaults();
    }

    public ConstraintThresholds thresholds() {
        return thresholds;
    }

    public ActiveConstraints evaluate(StateSnapshot state) {
        ActiveConstraints constraints = new ActiveConstraints();

        evaluateSleep(state, constraints);
        evaluateEnergy(state, constraints);
        evaluateStress(state, constraints);
        evaluateTime(state, constraints);
        evaluateEffort(state, constraints);
        evaluateCompound(constraints);

        return constraints;
    }

    private void evaluateSleep(StateSnapshot state, ActiveConstraints constraints) {
        double sleep = state.sleepHours();
        if (sleep < thresholds.criticalSleepHours()) {
            constraints.add(ConstraintType.CRITICAL_SLEEP, CRITICAL_SEVERITY, null, Constraint.SOURCE_WEARABLE);
        } else if (sleep < thresholds.minSleepHours()) {
            double severity = 1.0 - (sleep / thresholds.minSleepHours());
            constraints.add(ConstraintType.LOW_SLEEP, Math.min(GRADED_SEVERITY_CAP, severity),
                null, Constraint.SOURCE_WEARABLE);
        }

        double debt = state.sleepDebtHours();
        if (debt >= thresholds.sleepDebtCriticalHours()) {
            constraints.add(ConstraintType.SLEEP_DEBT_ACCUMULATED, DEBT_CRITICAL_SEVERITY,
                String.format(Locale.ROOT, "Accumulated sleep debt of %.1f hours", debt),
                Constraint.SOURCE_DERIVED);
        } else if (debt >= thresholds.sleepDebtWarningHours()) {
            constraints.add(ConstraintType.SLEEP_DEBT_ACCUMULATED, DEBT_WARNING_SEVERITY,
                String.format(Locale.ROOT, "Building sleep debt of %.1f hours", debt),
                Constraint.SOURCE_DERIVED);
        }
    }

    private void evaluateEnergy(StateSnapshot state, ActiveConstraints constraints) {
        int energy = state.energyLevel();
        if (energy <= thresholds.criticalEnergyThreshold()) {
            constraints.add(ConstraintType.CRITICAL_ENERGY, CRITICAL_SEVERITY, null, Constraint.SOURCE_DERIVED);
        } else if (energy <= thresholds.lowEnergyThreshold()) {
            double severity = 1.0 - ((double) energy / (thresholds.lowEnergyThreshold() + 2));
            constraints.add(ConstraintType.LOW_ENERGY, Math.min(GRADED_SEVERITY_CAP, severity),
                null, Constraint.SOURCE_DERIVED);
        }
    }

    private void evaluateStress(StateSnapshot state, ActiveConstraints constraints) {
        if (state.stressLevel() == StressLevel.HIGH) {
            constraints.add(ConstraintType.HIGH_STRESS, HIGH_STRESS_SEVERITY, null, Constraint.SOURCE_WEARABLE);
        }
    }

    private void evaluateTime(StateSnapshot state, ActiveConstraints constraints) {
        double time = state.timeAvailableHours();
        if (time < thresholds.minTimeHours()) {
            constraints.add(ConstraintType.TIME_CRITICAL, CRITICAL_SEVERITY, null, Constraint.SOURCE_USER_INPUT);
        } else if (time < thresholds.limitedTimeHours()) {
            double severity = 1.0 - (time / thresholds.limitedTimeHours());
            constraints.add(ConstraintType.TIME_LIMITED, Math.min(GRADED_SEVERITY_CAP, severity),
                null, Constraint.SOURCE_USER_INPUT);
        }
    }

    private void evaluateEffort(StateSnapshot state, ActiveConstraints constraints) {
        int days = state.consecutiveHighEffortDays();
        if (days >= thresholds.maxConsecutiveHighEffort()) {
            constraints.add(ConstraintType.OVERTRAINING_RISK, OVERTRAINING_SEVERITY,
                days + " consecutive high-effort days", Constraint.SOURCE_DERIVED);
        }
    }

    /** Burnout warning needs at least three of: sleep, energy, high stress, overtraining. */
    private void evaluateCompound(ActiveConstraints constraints) {
        int riskFactors = 0;
        if (constraints.hasAny(ConstraintType.LOW_SLEEP, ConstraintType.CRITICAL_SLEEP))   riskFactors++;
        if (constraints.hasAny(ConstraintType.LOW_ENERGY, ConstraintType.CRITICAL_ENERGY)) riskFactors++;
        if (constraints.has(ConstraintType.HIGH_STRESS))                                  riskFactors++;
        if (constraints.has(ConstraintType.OVERTRAINING_RISK))                            riskFactors++;

        if (riskFactors >= BURNOUT_FACTOR_MINIMUM) {
            constraints.add(ConstraintType.BURNOUT_WARNING, BURNOUT_SEVERITY,
                "Multiple risk factors indicate burnout risk", Constraint.SOURCE_DERIVED);
        }
    }

    /**
     * Human-readable listing, most severe first.
     * Labels: CRITICAL (&ge; 0.8), HIGH (&ge; 0.6), MODERATE otherwise.
     */
    public static String summarize(ActiveConstraints constraints) {
        if (constraints == null || constraints.isEmpty()) {
            return "No active constraints - full adherence possible";
        }
        List<String> lines = constraints.asList().stream()
            .sorted(Comparator.comparingDouble(Constraint::severity).reversed())
            .map(c -> String.format("  [%s] %s: %s", severityLabel(c.severity()), c.type().wireName(), c.description()))
            .collect(Collectors.toList());
        return "Active Constraints:\n" + String.join("\n", lines);
    }

    private static String severityLabel(double severity) {
        if (severity >= 0.8) return "CRITICAL";
        if (severity >= 0.6) return "HIGH";
        return "MODERATE";
    }
}
