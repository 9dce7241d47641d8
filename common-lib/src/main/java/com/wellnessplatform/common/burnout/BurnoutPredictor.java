package com.wellnessplatform.common.burnout;

import com.wellnessplatform.common.model.Category;
import com.wellnessplatform.common.model.DecisionAction;
import com.wellnessplatform.common.model.DomainDecision;
import com.wellnessplatform.common.model.StressLevel;
import com.wellnessplatform.common.model.TradeOffDecision;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Forecasts burnout from the trailing {@value #WINDOW_DAYS} days of decision history.
 *
 * <h3>Sub-scores (0–100 each)</h3>
 * <ul>
 *   <li><b>sleep</b>: mean below 6.5h / 7h, plus runs of sub-6h nights</li>
 *   <li><b>stress</b>: mean stress code at or above 2.5, plus runs of HIGH days</li>
 *   <li><b>recovery</b>: skip rate of recovery and mindfulness decisions</li>
 *   <li><b>energy</b>: mean day-over-day energy change (needs 3 entries)</li>
 * </ul>
 * Composite = {@code (int)(0.35·sleep + 0.30·stress + 0.20·recovery + 0.15·energy)}.
 *
 * <p>Stateless apart from the injected clock.
 */
public final class BurnoutPredictor {

    static final int WINDOW_DAYS         = 7;
    static final int CRITICAL_THRESHOLD  = 70;
    static final int MODERATE_THRESHOLD  = 30;
    static final int FACTOR_THRESHOLD    = 60;

    private final Clock clock;

    public BurnoutPredictor(Clock clock) {
        this.clock = clock;
    }

    public BurnoutForecast predict(List<TradeOffDecision> history) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(WINDOW_DAYS));
        List<TradeOffDecision> recent = history == null ? List.of() : history.stream()
            .filter(d -> !d.timestamp().isBefore(cutoff))
            .collect(Collectors.toList());

        if (recent.size() < 2) {
            return new BurnoutForecast(10, null, List.of("Insufficient data for analysis"), false,
                BurnoutSeverity.LOW);
        }

        int sleep    = sleepRisk(recent);
        int stress   = stressRisk(recent);
        int recovery = recoveryRisk(recent);
        int energy   = energyDeclineRisk(recent);

        int composite = (int) (sleep * 0.35 + stress * 0.30 + recovery * 0.20 + energy * 0.15);

        List<String> factors = new ArrayList<>();
        if (sleep > FACTOR_THRESHOLD)    factors.add("Sleep debt accumulation");
        if (stress > FACTOR_THRESHOLD)   factors.add("Chronic stress pattern");
        if (recovery > FACTOR_THRESHOLD) factors.add("Insufficient recovery");
        if (energy > FACTOR_THRESHOLD)   factors.add("Rapid energy decline");

        return new BurnoutForecast(
            composite,
            daysToCrisis(composite),
            factors,
            composite >= CRITICAL_THRESHOLD,
            BurnoutSeverity.fromScore(composite));
    }

    // ── Sub-scores ─────────────────────────────────────────────────

    static int sleepRisk(List<TradeOffDecision> decisions) {
        double mean = decisions.stream().mapToDouble(d -> d.stateSnapshot().sleepHours()).average().orElse(8.0);
        int run = longestRun(decisions, d -> d.stateSnapshot().sleepHours() < 6.0);

        int risk = 0;
        if (mean < 6.5)      risk += 40;
        else if (mean < 7.0) risk += 20;

        if (run >= 3)      risk += 50;
        else if (run >= 2) risk += 30;
        return Math.min(100, risk);
    }

    static int stressRisk(List<TradeOffDecision> decisions) {
        double mean = decisions.stream().mapToInt(d -> d.stateSnapshot().stressLevel().code()).average().orElse(1.0);
        int run = longestRun(decisions, d -> d.stateSnapshot().stressLevel() == StressLevel.HIGH);

        int risk = 0;
        if (mean >= 2.5) risk += 40;

        if (run >= 3)      risk += 60;
        else if (run >= 2) risk += 30;
        return Math.min(100, risk);
    }

    static int recoveryRisk(List<TradeOffDecision> decisions) {
        int opportunities = 0;
        int skipped = 0;
        for (TradeOffDecision decision : decisions) {
            for (DomainDecision d : decision.decisions()) {
                if (d.category() == Category.RECOVERY || d.category() == Category.MINDFULNESS) {
                    opportunities++;
                    if (d.action() == DecisionAction.SKIP) skipped++;
                }
            }
        }
        if (opportunities == 0) return 0;

        double rate = (double) skipped / opportunities;
        if (rate >= 0.6) return 80;
        if (rate >= 0.4) return 50;
        if (rate >= 0.2) return 25;
        return 0;
    }

    static int energyDeclineRisk(List<TradeOffDecision> decisions) {
        if (decisions.size() < 3) return 0;

        double totalChange = 0.0;
        for (int i = 1; i < decisions.size(); i++) {
            totalChange += decisions.get(i).stateSnapshot().energyLevel()
                         - decisions.get(i - 1).stateSnapshot().energyLevel();
        }
        double meanChange = totalChange / (decisions.size() - 1);

        if (meanChange <= -2.0) return 70;
        if (meanChange <= -1.0) return 40;
        if (meanChange < 0.0)   return 20;
        return 0;
    }

    static Integer daysToCrisis(int composite) {
        if (composite < MODERATE_THRESHOLD) return null;
        if (composite >= 90) return 1;
        if (composite >= 80) return 2;
        if (composite >= 70) return 3;
        if (composite >= 60) return 5;
        return 7;
    }

    private static int longestRun(List<TradeOffDecision> decisions,
                                  Predicate<TradeOffDecision> condition) {
        int current = 0;
        int longest = 0;
        for (TradeOffDecision d : decisions) {
            if (condition.test(d)) {
                current++;
                longest = Math.max(longest, current);
            } else {
                current = 0;
            }
        }
        return longest;
    }
}
