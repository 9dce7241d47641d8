package com.wellnessplatform.common.pattern;

import com.wellnessplatform.common.model.AdaptationRecord;
import com.wellnessplatform.common.model.Category;
import com.wellnessplatform.common.model.ConstraintType;
import com.wellnessplatform.common.model.DecisionAction;
import com.wellnessplatform.common.model.FutureImpact;
import com.wellnessplatform.common.model.PlannedTask;
import com.wellnessplatform.common.model.TradeOffDecision;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reshapes upcoming tasks from today's decision and from history patterns.
 *
 * <h3>Immediate (today's decision)</h3>
 * <ul>
 *   <li>{@code intensity_reduction} impact: fitness intensity × 0.6; {@code deload_week}: × 0.5.
 *       First matching impact wins.</li>
 *   <li>Fitness skipped today: the first upcoming fitness task becomes a light recovery workout.</li>
 * </ul>
 *
 * <h3>Patterns (needs {@value #MIN_HISTORY} history entries)</h3>
 * <ul>
 *   <li>Category skipped in more than half the window: its tasks shrink to 70% duration, 80% intensity.</li>
 *   <li>high_stress on 4+ entries: fitness intensity × 0.8.</li>
 *   <li>low_sleep on 5+ entries: sleep-hygiene advisory record only.</li>
 * </ul>
 *
 * <p>Stateless. Callers persist the returned records.
 */
public final class PlanAdjuster {

    static final int    MIN_HISTORY               = 3;
    static final double INTENSITY_REDUCTION_SCALE = 0.6;
    static final double DELOAD_SCALE              = 0.5;
    static final double FLEXIBLE_DURATION_SCALE   = 0.7;
    static final double FLEXIBLE_INTENSITY_SCALE  = 0.8;
    static final double STRESS_INTENSITY_SCALE    = 0.8;

    private final Clock clock;
    private final int windowDays;

    public PlanAdjuster(Clock clock) {
        this(clock, PatternDetector.DEFAULT_WINDOW_DAYS);
    }

    public PlanAdjuster(Clock clock, int windowDays) {
        this.clock      = clock;
        this.windowDays = windowDays;
    }

    public PlanAdjustment adjustFuturePlan(TradeOffDecision currentDecision, List<PlannedTask> upcomingTasks,
                                           List<TradeOffDecision> history) {
        List<PlannedTask> tasks = new ArrayList<>(upcomingTasks != null ? upcomingTasks : List.of());
        List<AdaptationRecord> records = new ArrayList<>();
        Instant now = clock.instant();

        if (currentDecision != null) {
            applyImmediate(currentDecision, tasks, records, now);
        }
        if (history != null && history.size() >= MIN_HISTORY) {
            applyPatterns(new PatternDetector(history, clock, windowDays), tasks, records, now);
        }
        return new PlanAdjustment(tasks, records);
    }

    // ── Immediate ──────────────────────────────────────────────────

    private void applyImmediate(TradeOffDecision decision, List<PlannedTask> tasks,
                                List<AdaptationRecord> records, Instant now) {
        double scale = 1.0;
        for (FutureImpact impact : decision.futureImpacts()) {
            if (FutureImpact.INTENSITY_REDUCTION.equals(impact.adjustmentType())) {
                scale = INTENSITY_REDUCTION_SCALE;
                break;
            }
            if (FutureImpact.DELOAD_WEEK.equals(impact.adjustmentType())) {
                scale = DELOAD_SCALE;
                break;
            }
        }

        if (scale < 1.0) {
            scaleFitnessIntensity(tasks, scale);
            records.add(new AdaptationRecord(now, "high_fatigue_signals",
                "Reduced all workout intensities to " + Math.round(scale * 100) + "%",
                List.of(Category.FITNESS),
                "Based on current fatigue indicators, reducing intensity to support recovery"));
        }

        boolean fitnessSkipped = decision.decisionFor(Category.FITNESS)
            .map(d -> d.action() == DecisionAction.SKIP)
            .orElse(false);
        if (fitnessSkipped) {
            for (int i = 0; i < tasks.size(); i++) {
                PlannedTask task = tasks.get(i);
                if (task.category() == Category.FITNESS) {
                    tasks.set(i, new PlannedTask(Category.FITNESS, "Recovery workout",
                        Math.min(30, task.durationMinutes()), 0.4, "Lighter workout following rest day"));
                    break;
                }
            }
        }
    }

    // ── Patterns ───────────────────────────────────────────────────

    private void applyPatterns(PatternDetector detector, List<PlannedTask> tasks,
                               List<AdaptationRecord> records, Instant now) {
        for (Category category : Category.values()) {
            double skipRate = detector.skipFrequency(category);
            if (skipRate <= 0.5) continue;

            for (int i = 0; i < tasks.size(); i++) {
                PlannedTask task = tasks.get(i);
                if (task.category() == category) {
                    tasks.set(i, task.withDurationAndIntensity(
                        "Flexible " + task.name(),
                        (int) (task.durationMinutes() * FLEXIBLE_DURATION_SCALE),
                        task.intensity() * FLEXIBLE_INTENSITY_SCALE,
                        "Adjusted based on adherence patterns: " + task.description()));
                }
            }
            records.add(new AdaptationRecord(now, "consistent_skip_" + category.wireName(),
                "Reduced " + category.wireName() + " expectations by 30%",
                List.of(category),
                String.format(Locale.ROOT, "%s is skipped %.0f%% of the time - adjusting to more realistic targets",
                    category.wireName(), skipRate * 100)));
        }

        Map<ConstraintType, Integer> counts = detector.constraintCounts();
        if (counts.getOrDefault(ConstraintType.HIGH_STRESS, 0) >= 4) {
            scaleFitnessIntensity(tasks, STRESS_INTENSITY_SCALE);
            records.add(new AdaptationRecord(now, "chronic_high_stress",
                "Increased mindfulness allocation, reduced fitness intensity",
                List.of(Category.MINDFULNESS, Category.FITNESS),
                "Persistent high stress pattern - rebalancing priorities for stress management"));
        }
        if (counts.getOrDefault(ConstraintType.LOW_SLEEP, 0) >= 5) {
            records.add(new AdaptationRecord(now, "chronic_sleep_deficit",
                "Recommend sleep hygiene review and reduced evening activities",
                List.of(Category.RECOVERY),
                "Consistent sleep issues detected - systemic adjustment recommended"));
        }
    }

    private static void scaleFitnessIntensity(List<PlannedTask> tasks, double scale) {
        for (int i = 0; i < tasks.size(); i++) {
            PlannedTask task = tasks.get(i);
            if (task.category() == Category.FITNESS) {
                tasks.set(i, task.withDurationAndIntensity(task.name(), task.durationMinutes(),
                    task.intensity() * scale, task.description()));
            }
        }
    }
}
