package com.wellnessplatform.common.simulation;

import com.wellnessplatform.common.constraint.ConstraintEvaluator;
import com.wellnessplatform.common.model.ActiveConstraints;
import com.wellnessplatform.common.model.Category;
import com.wellnessplatform.common.model.ConstraintType;
import com.wellnessplatform.common.model.DecisionAction;
import com.wellnessplatform.common.model.DomainDecision;
import com.wellnessplatform.common.model.DomainPreferences;
import com.wellnessplatform.common.model.PlannedTask;
import com.wellnessplatform.common.model.StateSnapshot;
import com.wellnessplatform.common.model.StressLevel;
import com.wellnessplatform.common.model.TradeOffDecision;
import com.wellnessplatform.common.priority.PriorityMatrix;
import com.wellnessplatform.common.tradeoff.TradeOffEngine;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Projects a week forward from the current state, assuming the user follows every
 * recommendation, and runs the trade-off engine on each projected day.
 *
 * <h3>Daily step</h3>
 * <ol>
 *   <li>HIGH stress: sleep +1h (max 9) and stress drops to MEDIUM.</li>
 *   <li>MEDIUM stress: energy above 6 drops stress to LOW, otherwise sleep +0.5h (max 8.5).</li>
 *   <li>Sleep at or above 8h gives +1 energy, under 6h gives −1.</li>
 *   <li>Sleep debt grows by the shortfall against 8h and shrinks by any surplus.</li>
 *   <li>High-effort days count up while fitness is kept and reset when it is not.</li>
 * </ol>
 *
 * <p>Deterministic given its inputs and the clock. Day 1 is the day after the clock's date.
 */
public final class WeekSimulator {

    public static final int SIMULATED_DAYS = 7;
    public static final int MIN_HISTORY    = 3;

    static final int TOP_CONSTRAINTS = 5;

    /** Used when the caller supplies no plan. */
    public static final List<PlannedTask> SAMPLE_TASKS = List.of(
        new PlannedTask(Category.FITNESS,     "HIIT Workout",       45, 0.8, "High-intensity interval training"),
        new PlannedTask(Category.NUTRITION,   "Meal Prep",          60, 0.3, "Prepare healthy meals for the week"),
        new PlannedTask(Category.RECOVERY,    "Sleep Optimization", 30, 0.1, "Wind-down routine before bed"),
        new PlannedTask(Category.MINDFULNESS, "Meditation Session", 20, 0.2, "Guided mindfulness meditation"));

    private final ConstraintEvaluator evaluator;
    private final PriorityMatrix priorityMatrix;
    private final Clock clock;

    public WeekSimulator(ConstraintEvaluator evaluator, PriorityMatrix priorityMatrix, Clock clock) {
        this.evaluator      = evaluator;
        this.priorityMatrix = priorityMatrix;
        this.clock          = clock;
    }

    /**
     * @param historyCount decisions already recorded; each simulated day counts as one more
     */
    public SimulationResult simulate(StateSnapshot current, SimulationScenario scenario, double dailyHours,
                                     List<PlannedTask> tasks, DomainPreferences preferences, int historyCount) {
        List<PlannedTask> plan = tasks != null && !tasks.isEmpty() ? tasks : SAMPLE_TASKS;
        StateSnapshot state = scenario.applyTo(current, dailyHours);
        LocalDate today = LocalDate.now(clock);

        double sleep = state.sleepHours();
        int energy = state.energyLevel();
        StressLevel stress = state.stressLevel();
        double debt = state.sleepDebtHours();
        int effortDays = state.consecutiveHighEffortDays();

        List<DailyProjection> projections = new ArrayList<>();
        for (int day = 1; day <= SIMULATED_DAYS; day++) {
            if (stress == StressLevel.HIGH) {
                sleep = Math.min(9.0, sleep + 1.0);
                stress = StressLevel.MEDIUM;
            } else if (stress == StressLevel.MEDIUM) {
                if (energy > 6) {
                    stress = StressLevel.LOW;
                } else {
                    sleep = Math.min(8.5, sleep + 0.5);
                }
            }

            if (sleep >= 8.0) {
                energy++;
            } else if (sleep < 6.0) {
                energy--;
            }
            energy = Math.max(1, Math.min(10, energy));
            sleep = Math.max(4.0, Math.min(10.0, sleep));
            debt = Math.max(0.0, debt + DailyMetrics.IDEAL_SLEEP_HOURS - sleep);

            StateSnapshot dayState = new StateSnapshot(sleep, energy, stress, dailyHours, debt, effortDays);
            TradeOffDecision decision = decideFor(day, dayState, plan, preferences);
            DailyMetrics metrics = DailyMetrics.of(dayState, historyCount + day - 1);

            LocalDate date = today.plusDays(day);
            projections.add(new DailyProjection(day, date,
                date.getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.ENGLISH),
                dayState, stressLoad(stress), energy * 10, metrics, decision));

            effortDays = fitnessKept(decision) ? effortDays + 1 : 0;
            state = dayState;
        }

        return new SimulationResult(scenario, projections, state, insights(projections), summarize(projections));
    }

    private TradeOffDecision decideFor(int day, StateSnapshot state, List<PlannedTask> plan,
                                       DomainPreferences preferences) {
        Clock dayClock = Clock.offset(clock, Duration.ofDays(day));
        TradeOffEngine engine = new TradeOffEngine(priorityMatrix, preferences, dayClock);
        ActiveConstraints constraints = evaluator.evaluate(state);
        return engine.decide(state, constraints, plan);
    }

    private static boolean fitnessKept(TradeOffDecision decision) {
        return decision.decisionFor(Category.FITNESS)
            .map(d -> d.action() == DecisionAction.PRIORITIZE || d.action() == DecisionAction.MAINTAIN)
            .orElse(false);
    }

    static int stressLoad(StressLevel stress) {
        return switch (stress) {
            case HIGH -> 80;
            case MEDIUM -> 50;
            case LOW -> 20;
        };
    }

    // ── Week roll-up ───────────────────────────────────────────────

    static List<String> insights(List<DailyProjection> projections) {
        int totalReadiness = 0;
        DailyProjection lowest = projections.get(0);
        for (DailyProjection p : projections) {
            totalReadiness += p.metrics().readinessScore();
            if (p.metrics().readinessScore() < lowest.metrics().readinessScore()) lowest = p;
        }
        int average = totalReadiness / projections.size();

        return List.of(
            "Average readiness for the week: " + average + "%",
            "Lowest point expected on: " + lowest.dayOfWeek(),
            average > 50
                ? "Recovery protocols effectively manage stress spikes."
                : "High stress load detected. Aggressive recovery recommended.");
    }

    static WeekSummary summarize(List<DailyProjection> projections) {
        Map<DecisionAction, Integer> actions = new EnumMap<>(DecisionAction.class);
        Map<Category, Map<DecisionAction, Integer>> byCategory = new EnumMap<>(Category.class);
        Map<ConstraintType, Integer> constraintCounts = new LinkedHashMap<>();
        int total = 0;
        double sleepSum = 0.0;
        int burnoutDays = 0;

        for (DailyProjection p : projections) {
            for (DomainDecision d : p.decision().decisions()) {
                actions.merge(d.action(), 1, Integer::sum);
                byCategory.computeIfAbsent(d.category(), c -> new EnumMap<>(DecisionAction.class))
                    .merge(d.action(), 1, Integer::sum);
                total++;
            }
            for (ConstraintType type : p.decision().constraintsActive()) {
                constraintCounts.merge(type, 1, Integer::sum);
            }
            if (p.decision().constraintsActive().contains(ConstraintType.BURNOUT_WARNING)) burnoutDays++;
            sleepSum += p.state().sleepHours();
        }

        // stable sort keeps first-seen order among equal counts
        Map<ConstraintType, Integer> top = constraintCounts.entrySet().stream()
            .sorted(Map.Entry.<ConstraintType, Integer>comparingByValue().reversed())
            .limit(TOP_CONSTRAINTS)
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));

        double averageSleep = Math.round(sleepSum / projections.size() * 10.0) / 10.0;
        return new WeekSummary(projections.size(), total, actions, byCategory, top, averageSleep, burnoutDays);
    }
}
