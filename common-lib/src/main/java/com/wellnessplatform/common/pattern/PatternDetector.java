package com.wellnessplatform.common.pattern;

import com.wellnessplatform.common.model.Category;
import com.wellnessplatform.common.model.ConstraintType;
import com.wellnessplatform.common.model.DecisionAction;
import com.wellnessplatform.common.model.TradeOffDecision;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only statistics over a decision history.
 *
 * <p>Frequencies are computed over the trailing window (relative to the clock) and
 * divide by the number of history entries in that window. The day-of-week breakdown
 * covers the whole history.
 */
public final class PatternDetector {

    public static final int DEFAULT_WINDOW_DAYS = 7;
    static final int MIN_HISTORY_FOR_REPORT    = 3;

    private final List<TradeOffDecision> history;
    private final List<TradeOffDecision> window;
    private final Clock clock;
    private final int windowDays;

    public PatternDetector(List<TradeOffDecision> history, Clock clock) {
        this(history, clock, DEFAULT_WINDOW_DAYS);
    }

    public PatternDetector(List<TradeOffDecision> history, Clock clock, int windowDays) {
        this.history    = history != null ? List.copyOf(history) : List.of();
        this.clock      = clock;
        this.windowDays = windowDays;

        Instant cutoff = clock.instant().minus(Duration.ofDays(windowDays));
        this.window = this.history.stream()
            .filter(d -> !d.timestamp().isBefore(cutoff))
            .collect(Collectors.toList());
    }

    public double skipFrequency(Category category) {
        return actionFrequency(category, DecisionAction.SKIP);
    }

    public double downgradeFrequency(Category category) {
        return actionFrequency(category, DecisionAction.DOWNGRADE);
    }

    private double actionFrequency(Category category, DecisionAction action) {
        if (window.isEmpty()) return 0.0;
        long matches = window.stream()
            .flatMap(d -> d.decisions().stream())
            .filter(d -> d.category() == category && d.action() == action)
            .count();
        return (double) matches / window.size();
    }

    /** Occurrences of each constraint type in the window, in first-seen order. */
    public Map<ConstraintType, Integer> constraintCounts() {
        Map<ConstraintType, Integer> counts = new LinkedHashMap<>();
        for (TradeOffDecision d : window) {
            for (ConstraintType type : d.constraintsActive()) {
                counts.merge(type, 1, Integer::sum);
            }
        }
        return counts;
    }

    public Map<DayOfWeek, DayOfWeekStats> dayOfWeekBreakdown() {
        Map<DayOfWeek, int[]> raw = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            raw.put(day, new int[3]);
        }
        for (TradeOffDecision d : history) {
            int[] counters = raw.get(d.timestamp().atZone(clock.getZone()).getDayOfWeek());
            counters[0]++;
            counters[1] += d.constraintsActive().size();
            counters[2] += (int) d.decisions().stream().filter(dd -> dd.action() == DecisionAction.SKIP).count();
        }

        Map<DayOfWeek, DayOfWeekStats> stats = new EnumMap<>(DayOfWeek.class);
        raw.forEach((day, c) -> stats.put(day, DayOfWeekStats.of(c[0], c[1], c[2])));
        return stats;
    }

    public PatternReport weeklyReport() {
        return weeklyReport(0);
    }

    /**
     * @param adaptationsMade number of adaptation records logged so far, reported as-is
     */
    public PatternReport weeklyReport(int adaptationsMade) {
        if (history.size() < MIN_HISTORY_FOR_REPORT) {
            return PatternReport.insufficientData(history.size());
        }

        Map<Category, CategoryRates> categories = new EnumMap<>(Category.class);
        List<String> recommendations = new ArrayList<>();
        for (Category category : Category.values()) {
            double skipPct      = roundPercent(skipFrequency(category));
            double downgradePct = roundPercent(downgradeFrequency(category));
            categories.put(category, new CategoryRates(skipPct, downgradePct));

            if (skipPct > 40.0) {
                recommendations.add("Consider reducing " + category.wireName()
                    + " targets - current plan may be too ambitious");
            } else if (downgradePct > 60.0) {
                recommendations.add(category.wireName()
                    + " frequently downgraded - consider adjusting default intensity");
            }
        }

        Map<ConstraintType, Integer> constraintFrequency = constraintCounts();
        if (constraintFrequency.getOrDefault(ConstraintType.HIGH_STRESS, 0) >= 4) {
            recommendations.add("High stress is frequent - consider adding more recovery buffers");
        }

        return new PatternReport(
            PatternReport.Status.OK,
            "last_" + windowDays + "_days",
            history.size(),
            categories,
            constraintFrequency,
            dayOfWeekBreakdown(),
            adaptationsMade,
            recommendations);
    }

    public int windowSize() {
        return window.size();
    }

    private static double roundPercent(double fraction) {
        return Math.round(fraction * 1000.0) / 10.0;
    }
}
