package com.wellnessplatform.common.tradeoff;

import com.wellnessplatform.common.model.ActiveConstraints;
import com.wellnessplatform.common.model.Category;
import com.wellnessplatform.common.model.ConstraintType;
import com.wellnessplatform.common.model.DecisionAction;
import com.wellnessplatform.common.model.DomainDecision;
import com.wellnessplatform.common.model.DomainPreferences;
import com.wellnessplatform.common.model.FutureImpact;
import com.wellnessplatform.common.model.PlannedTask;
import com.wellnessplatform.common.model.StateSnapshot;
import com.wellnessplatform.common.model.TradeOffDecision;
import com.wellnessplatform.common.priority.PriorityMatrix;
import com.wellnessplatform.common.priority.PriorityResult;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Core trade-off engine: decides, per category, whether today's planned task is
 * prioritized, kept, downgraded or skipped under the active constraints.
 *
 * <h3>Cycle</h3>
 * <ol>
 *   <li>Adjusted priorities from {@link PriorityMatrix} (blended with the configured preferences).</li>
 *   <li>Categories ranked by descending priority, ties in {@link PriorityMatrix#BASE_ORDER}.</li>
 *   <li>Effective capacity = available minutes scaled by {@code energyLevel / 10}.</li>
 *   <li>First task per category decided in rank order; time starvation overrides the
 *       category rules.</li>
 *   <li>MAINTAIN with priority at or above {@value #PRIORITY_BOOST_THRESHOLD} is promoted.</li>
 *   <li>Future impacts, confidence and a one-line summary close the cycle.</li>
 * </ol>
 *
 * <p>Holds no mutable state. Never throws for in-range domain inputs.
 */
public final class TradeOffEngine {

    static final double PRIORITY_BOOST_THRESHOLD   = 0.35;
    static final double MINIMAL_VERSION_THRESHOLD  = 0.30;
    static final double STARVATION_RATIO           = 0.5;
    static final double MINIMAL_INTENSITY          = 0.2;
    static final double LOW_ENERGY_INTENSITY_SCALE = 0.6;
    static final int    LOW_ENERGY_MINDFULNESS     = 3;

    private final PriorityMatrix priorityMatrix;
    private final DomainPreferences preferences;
    private final Clock clock;

    public TradeOffEngine() {
        this(new PriorityMatrix(), null, Clock.systemUTC());
    }

    /**
     * @param preferences optional per-category preferences; {@code null} disables blending
     */
    public TradeOffEngine(PriorityMatrix priorityMatrix, DomainPreferences preferences, Clock clock) {
        this.priorityMatrix = priorityMatrix;
        this.preferences    = preferences;
        this.clock          = clock;
    }

    /** Same matrix and clock, different preferences. Used per request when the profile changes. */
    public TradeOffEngine withPreferences(DomainPreferences newPreferences) {
        return new TradeOffEngine(priorityMatrix, newPreferences, clock);
    }

    public TradeOffDecision decide(StateSnapshot state, ActiveConstraints constraints,
                                   List<PlannedTask> plannedTasks) {
        List<PlannedTask> tasks = plannedTasks != null ? plannedTasks : List.of();
        PriorityResult priorities = priorityMatrix.calculate(constraints, preferences);

        double capacity = state.timeAvailableHours() * 60.0 * state.energyLevel() / 10.0;
        double minutesUsed = 0.0;

        List<DomainDecision> decisions = new ArrayList<>();
        for (Category category : rank(priorities.priorities())) {
            Optional<PlannedTask> first = tasks.stream()
                .filter(t -> t.category() == category)
                .findFirst();
            if (first.isEmpty()) continue;

            PlannedTask task = first.get();
            double priority = priorities.priorityOf(category);
            DomainDecision decision = decideTask(task, priority, constraints, capacity - minutesUsed, state);

            switch (decision.action()) {
                case PRIORITIZE, MAINTAIN -> minutesUsed += task.durationMinutes();
                case DOWNGRADE -> minutesUsed += decision.adjustedTask().durationMinutes();
                default -> { }
            }
            decisions.add(decision);
        }

        List<FutureImpact> impacts = futureImpacts(decisions, state, constraints);

        return new TradeOffDecision(
            UUID.randomUUID().toString(),
            clock.instant(),
            state,
            constraints.names(),
            priorities.adjustments(),
            decisions,
            impacts,
            confidence(constraints),
            summarize(decisions, constraints)
        );
    }

    // ── Ranking ────────────────────────────────────────────────────

    static List<Category> rank(Map<Category, Double> priorities) {
        // List.sort is stable, so BASE_ORDER settles ties
        List<Category> ranked = new ArrayList<>(PriorityMatrix.BASE_ORDER);
        ranked.sort(Comparator.comparingDouble((Category c) -> priorities.getOrDefault(c, 0.0)).reversed());
        return ranked;
    }

    // ── Per-task decision ──────────────────────────────────────────

    private DomainDecision decideTask(PlannedTask task, double priority, ActiveConstraints constraints,
                                      double minutesRemaining, StateSnapshot state) {
        RuleOutcome outcome;
        String categoryName = task.category().wireName();

        if (minutesRemaining < task.durationMinutes() * STARVATION_RATIO) {
            outcome = priority >= MINIMAL_VERSION_THRESHOLD
                ? RuleOutcome.downgrade(minimalVersion(task),
                    "Time critically limited but " + categoryName + " is high priority - minimal version")
                : RuleOutcome.of(DecisionAction.SKIP,
                    "Insufficient time and " + categoryName + " not highest priority today");
        } else {
            outcome = switch (task.category()) {
                case FITNESS     -> decideFitness(task, constraints);
                case RECOVERY    -> decideRecovery(task, constraints);
                case MINDFULNESS -> decideMindfulness(task, constraints, state);
                case NUTRITION   -> decideNutrition(task, constraints);
            };
        }

        if (outcome.action() == DecisionAction.MAINTAIN && priority >= PRIORITY_BOOST_THRESHOLD) {
            outcome = RuleOutcome.of(DecisionAction.PRIORITIZE, String.format(Locale.ROOT,
                "High adjusted priority (%.2f) - prioritizing %s", priority, categoryName));
        }

        String reasoning = outcome.reasoning() != null && !outcome.reasoning().isBlank()
            ? outcome.reasoning()
            : "Standard execution of " + task.name();

        return new DomainDecision(task.category(), outcome.action(), task, outcome.adjustedTask(),
            reasoning, priority);
    }

    private RuleOutcome decideFitness(PlannedTask task, ActiveConstraints constraints) {
        if (constraints.has(ConstraintType.BURNOUT_WARNING)) {
            return RuleOutcome.of(DecisionAction.SKIP,
                "Burnout risk detected - skipping workout to prioritize recovery");
        }
        if (constraints.hasAny(ConstraintType.CRITICAL_SLEEP, ConstraintType.CRITICAL_ENERGY)) {
            return RuleOutcome.downgrade(
                replacement(Category.FITNESS, "Light stretching", 10, 0.2, "Gentle movement only"),
                "Critical fatigue - replacing with light stretching to maintain movement habit");
        }
        if (constraints.has(ConstraintType.HIGH_STRESS) && constraints.has(ConstraintType.LOW_SLEEP)) {
            return RuleOutcome.downgrade(
                replacement(Category.FITNESS, "Recovery walk", 20, 0.3, "Low-intensity outdoor walk"),
                "High stress + poor sleep - replacing planned workout with recovery walk");
        }
        if (constraints.has(ConstraintType.OVERTRAINING_RISK)) {
            return RuleOutcome.downgrade(
                replacement(Category.FITNESS, "Mobility work", 15, 0.25, "Active recovery mobility"),
                "Overtraining risk - substituting with mobility work for active recovery");
        }
        if (constraints.has(ConstraintType.LOW_ENERGY)) {
            PlannedTask reduced = task.withDurationAndIntensity(
                task.name() + " (reduced intensity)",
                task.durationMinutes(),
                task.intensity() * LOW_ENERGY_INTENSITY_SCALE,
                "Lower intensity version: " + task.description());
            return RuleOutcome.downgrade(reduced, "Low energy - reducing workout intensity by 40%");
        }
        return RuleOutcome.of(DecisionAction.MAINTAIN, "Conditions favorable for planned workout");
    }

    private RuleOutcome decideRecovery(PlannedTask task, ActiveConstraints constraints) {
        if (constraints.hasAny(ConstraintType.CRITICAL_SLEEP, ConstraintType.BURNOUT_WARNING,
                               ConstraintType.OVERTRAINING_RISK)) {
            return RuleOutcome.of(DecisionAction.PRIORITIZE,
                "Recovery critical due to active fatigue/burnout signals");
        }
        if (constraints.has(ConstraintType.TIME_CRITICAL)) {
            return RuleOutcome.downgrade(
                replacement(Category.RECOVERY, "Power nap", 20, 0.1, "Quick restorative rest"),
                "Time critical - condensed recovery with power nap");
        }
        return RuleOutcome.of(DecisionAction.MAINTAIN, "Recovery as planned");
    }

    private RuleOutcome decideMindfulness(PlannedTask task, ActiveConstraints constraints, StateSnapshot state) {
        if (constraints.has(ConstraintType.HIGH_STRESS)) {
            return RuleOutcome.of(DecisionAction.PRIORITIZE,
                "High stress detected - prioritizing mindfulness for stress reduction");
        }
        if (constraints.has(ConstraintType.TIME_CRITICAL)) {
            return RuleOutcome.downgrade(
                replacement(Category.MINDFULNESS, "Breathing exercise", 5, 0.2, "Quick box breathing"),
                "Time critical - condensed to 5-minute breathing exercise");
        }
        if (state.energyLevel() <= LOW_ENERGY_MINDFULNESS) {
            return RuleOutcome.of(DecisionAction.PRIORITIZE,
                "Low energy state - meditation supports recovery without physical demand");
        }
        return RuleOutcome.of(DecisionAction.MAINTAIN, "Mindfulness as planned");
    }

    private RuleOutcome decideNutrition(PlannedTask task, ActiveConstraints constraints) {
        if (constraints.has(ConstraintType.TIME_CRITICAL)) {
            return RuleOutcome.downgrade(
                replacement(Category.NUTRITION, "Simple healthy meal", 10, 0.1,
                    "Pre-prepared or quick healthy option"),
                "Time critical - simplify to pre-prepared healthy option rather than cooking");
        }
        if (constraints.has(ConstraintType.LOW_ENERGY)) {
            // MAINTAIN carries no adjusted task; the guidance lives in the reasoning
            return RuleOutcome.of(DecisionAction.MAINTAIN,
                "Low energy - keep " + task.name()
                    + " but focus on energy-supportive nutrients (complex carbs, lean protein)");
        }
        return RuleOutcome.of(DecisionAction.MAINTAIN, "Nutrition plan as scheduled");
    }

    private static PlannedTask replacement(Category category, String name, int minutes, double intensity,
                                           String description) {
        return new PlannedTask(category, name, minutes, intensity, description);
    }

    static PlannedTask minimalVersion(PlannedTask task) {
        int minutes = switch (task.category()) {
            case FITNESS, RECOVERY        -> 10;
            case NUTRITION, MINDFULNESS   -> 5;
        };
        return task.withDurationAndIntensity("Minimal " + task.name(), minutes, MINIMAL_INTENSITY,
            "Abbreviated version of: " + task.description());
    }

    // ── Future impacts ─────────────────────────────────────────────

    private static List<FutureImpact> futureImpacts(List<DomainDecision> decisions, StateSnapshot state,
                                                    ActiveConstraints constraints) {
        List<FutureImpact> impacts = new ArrayList<>();

        boolean fitnessReduced = decisions.stream()
            .anyMatch(d -> d.category() == Category.FITNESS && d.action().isReduction());
        if (fitnessReduced) {
            if (constraints.hasAny(ConstraintType.BURNOUT_WARNING, ConstraintType.OVERTRAINING_RISK)) {
                impacts.add(new FutureImpact(3, FutureImpact.INTENSITY_REDUCTION,
                    "Reducing workout intensity to 60% for the next 3 days"));
            } else {
                impacts.add(new FutureImpact(1, FutureImpact.WORKOUT_RESCHEDULE,
                    "Consider adding light activity tomorrow if energy improves"));
            }
        }

        if (state.sleepDebtHours() > 4.0) {
            impacts.add(new FutureImpact(2, FutureImpact.SLEEP_EXTENSION, String.format(Locale.ROOT,
                "Recommend adding 30 min to sleep for 2 nights to address %.1fh debt", state.sleepDebtHours())));
        }

        if (constraints.has(ConstraintType.BURNOUT_WARNING)) {
            impacts.add(new FutureImpact(7, FutureImpact.DELOAD_WEEK,
                "Consider a deload week: reduce all fitness intensity by 50%"));
        }
        return impacts;
    }

    // ── Confidence and summary ─────────────────────────────────────

    static double confidence(ActiveConstraints constraints) {
        if (constraints.isEmpty()) return 0.95;
        return Math.max(0.5, 0.9 - constraints.meanSeverity() * 0.3);
    }

    static String summarize(List<DomainDecision> decisions, ActiveConstraints constraints) {
        String prioritized = categoriesWith(decisions, DecisionAction.PRIORITIZE);
        String downgraded  = categoriesWith(decisions, DecisionAction.DOWNGRADE);
        String skipped     = categoriesWith(decisions, DecisionAction.SKIP);

        if (prioritized.isEmpty() && downgraded.isEmpty() && skipped.isEmpty()) {
            return "All tasks maintained as planned.";
        }

        List<String> parts = new ArrayList<>();
        if (!constraints.isEmpty()) parts.add("Given " + constraints.size() + " active constraints");
        if (!prioritized.isEmpty()) parts.add("prioritized " + prioritized);
        if (!downgraded.isEmpty())  parts.add("downgraded " + downgraded);
        if (!skipped.isEmpty())     parts.add("skipped " + skipped);
        return String.join("; ", parts) + ".";
    }

    private static String categoriesWith(List<DomainDecision> decisions, DecisionAction action) {
        return decisions.stream()
            .filter(d -> d.action() == action)
            .map(d -> d.category().wireName())
            .collect(Collectors.joining(", "));
    }
}
