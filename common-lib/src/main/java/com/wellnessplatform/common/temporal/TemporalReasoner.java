package com.wellnessplatform.common.temporal;

import com.wellnessplatform.common.model.StateSnapshot;
import com.wellnessplatform.common.model.StressLevel;
import com.wellnessplatform.common.model.TradeOffDecision;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads the decision history across three horizons: recurring patterns in the past,
 * risk in the present moment, and projected trajectories.
 *
 * <p>Weekdays and time of day are resolved in the clock's zone.
 */
public final class TemporalReasoner {

    static final int    MIN_HISTORY_FOR_PATTERNS = 7;
    static final double WEEKDAY_PATTERN_THRESHOLD = 0.6;
    static final int    SIMILAR_LOOKBACK          = 14;

    private final Clock clock;

    public TemporalReasoner(Clock clock) {
        this.clock = clock;
    }

    public TemporalInsight analyze(List<TradeOffDecision> history, StateSnapshot state) {
        List<TradeOffDecision> entries = history != null ? history : List.of();

        List<RecurringPattern> patterns = detectRecurringPatterns(entries);
        PresentContext present = assessPresent(entries, state);
        List<FutureTrajectory> trajectories = projectOutcomes(patterns, present, state);

        return new TemporalInsight(patterns, present, trajectories,
            recommendation(patterns, present, trajectories),
            urgency(present, trajectories));
    }

    // ── Past ───────────────────────────────────────────────────────

    List<RecurringPattern> detectRecurringPatterns(List<TradeOffDecision> history) {
        if (history.size() < MIN_HISTORY_FOR_PATTERNS) return List.of();

        List<RecurringPattern> patterns = new ArrayList<>(weekdayAvoidance(history));

        List<TradeOffDecision> highStress = history.stream()
            .filter(d -> d.stateSnapshot().stressLevel() == StressLevel.HIGH)
            .collect(Collectors.toList());
        if (highStress.size() >= 3) {
            double rate = skipRate(highStress);
            if (rate >= 0.5) {
                patterns.add(new RecurringPattern("situational", "Stress-Induced Avoidance", rate, 0.8,
                    List.of(String.format(Locale.ROOT, "Skip rate under stress: %.0f%%", rate * 100))));
            }
        }

        int run = 0;
        int longest = 0;
        for (TradeOffDecision d : history) {
            run = d.stateSnapshot().sleepHours() < 6.5 ? run + 1 : 0;
            longest = Math.max(longest, run);
        }
        if (longest >= 3) {
            patterns.add(new RecurringPattern("trigger-based", "Sleep Debt Cascade",
                (double) longest / history.size(), 0.85,
                List.of(longest + " consecutive low-sleep days detected")));
        }
        return patterns;
    }

    private List<RecurringPattern> weekdayAvoidance(List<TradeOffDecision> history) {
        Map<DayOfWeek, List<TradeOffDecision>> byDay = new EnumMap<>(DayOfWeek.class);
        for (TradeOffDecision d : history) {
            byDay.computeIfAbsent(dayOf(d), k -> new ArrayList<>()).add(d);
        }

        List<RecurringPattern> patterns = new ArrayList<>();
        byDay.forEach((day, entries) -> {
            if (entries.size() < 2) return;
            long skipped = entries.stream().filter(TradeOffDecision::hasSkip).count();
            double rate = (double) skipped / entries.size();
            if (rate >= WEEKDAY_PATTERN_THRESHOLD) {
                String name = displayName(day);
                patterns.add(new RecurringPattern("weekly", name + " Avoidance Pattern", rate,
                    Math.min(0.9, rate + 0.1),
                    List.of("Skipped " + skipped + "/" + entries.size() + " " + name + "s")));
            }
        });
        return patterns;
    }

    // ── Present ────────────────────────────────────────────────────

    PresentContext assessPresent(List<TradeOffDecision> history, StateSnapshot state) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        DayOfWeek today = now.getDayOfWeek();
        int hour = now.getHour();
        String timeOfDay = hour < 12 ? "morning" : hour < 17 ? "afternoon" : "evening";

        List<SimilarSituation> similar = history
            .subList(Math.max(0, history.size() - SIMILAR_LOOKBACK), history.size())
            .stream()
            .filter(d -> dayOf(d) == today)
            .map(d -> new SimilarSituation(d.timestamp().atZone(clock.getZone()).toLocalDate(),
                d.hasSkip() ? "skipped" : "completed"))
            .collect(Collectors.toList());

        List<String> factors = new ArrayList<>();
        int points = 0;
        double sleep = state.sleepHours();
        if (sleep < 6.0) {
            factors.add(String.format(Locale.ROOT, "Critical sleep debt (%.1fh)", sleep));
            points += 3;
        } else if (sleep < 7.0) {
            factors.add(String.format(Locale.ROOT, "Moderate sleep debt (%.1fh)", sleep));
            points += 1;
        }
        if (state.stressLevel() == StressLevel.HIGH) {
            factors.add("High stress level");
            points += 2;
        }
        if (state.energyLevel() <= 3) {
            factors.add("Low energy (" + state.energyLevel() + "/10)");
            points += 2;
        }

        return new PresentContext(today, timeOfDay, similar, RiskLevel.fromPoints(points), factors);
    }

    // ── Future ─────────────────────────────────────────────────────

    List<FutureTrajectory> projectOutcomes(List<RecurringPattern> patterns, PresentContext present,
                                           StateSnapshot state) {
        List<FutureTrajectory> trajectories = new ArrayList<>();
        if (present.riskLevel() == RiskLevel.HIGH || present.riskLevel() == RiskLevel.CRITICAL) {
            trajectories.add(new FutureTrajectory("24h", "Energy crash and decision fatigue", 0.75,
                ImpactLevel.MODERATE, "Next 4 hours"));
        }
        if (state.sleepHours() < 6.5) {
            trajectories.add(new FutureTrajectory("1 week",
                "Accumulated sleep debt leading to immune suppression", 0.65,
                ImpactLevel.MAJOR, "Tonight (prioritize 8h sleep)"));
        }
        for (RecurringPattern pattern : patterns) {
            if (pattern.frequency() >= 0.7) {
                trajectories.add(new FutureTrajectory("1 month", "Habit collapse due to " + pattern.description(),
                    pattern.frequency(), ImpactLevel.SEVERE, "This week (break the pattern)"));
            }
        }
        return trajectories;
    }

    static String recommendation(List<RecurringPattern> patterns, PresentContext present,
                                 List<FutureTrajectory> trajectories) {
        if (present.riskLevel() == RiskLevel.CRITICAL) {
            return "CRITICAL: " + String.join(", ", present.riskFactors()) + ". Immediate rest required.";
        }
        if (!trajectories.isEmpty() && trajectories.get(0).impactLevel().compareTo(ImpactLevel.MAJOR) >= 0) {
            FutureTrajectory first = trajectories.get(0);
            return "Pattern Alert: " + first.predictedOutcome() + ". " + first.interventionWindow();
        }
        if (!patterns.isEmpty()) {
            return "Detected: " + patterns.get(0).description() + ". Consider breaking this pattern today.";
        }
        return "No immediate concerns. Maintain current trajectory.";
    }

    static int urgency(PresentContext present, List<FutureTrajectory> trajectories) {
        if (present.riskLevel() == RiskLevel.CRITICAL) return 5;
        if (present.riskLevel() == RiskLevel.HIGH) return 4;

        ImpactLevel worst = trajectories.stream()
            .map(FutureTrajectory::impactLevel)
            .max(Comparator.naturalOrder())
            .orElse(ImpactLevel.MINOR);
        if (worst == ImpactLevel.SEVERE) return 4;
        if (worst == ImpactLevel.MAJOR) return 3;

        return present.riskLevel() == RiskLevel.MODERATE ? 2 : 1;
    }

    // ── Helpers ────────────────────────────────────────────────────

    private DayOfWeek dayOf(TradeOffDecision decision) {
        return decision.timestamp().atZone(clock.getZone()).getDayOfWeek();
    }

    private static double skipRate(List<TradeOffDecision> entries) {
        long skipped = entries.stream().filter(TradeOffDecision::hasSkip).count();
        return (double) skipped / entries.size();
    }

    private static String displayName(DayOfWeek day) {
        return day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }
}
