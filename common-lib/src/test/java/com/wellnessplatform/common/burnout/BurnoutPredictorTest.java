package com.wellnessplatform.common.burnout;

import com.wellnessplatform.common.HistoryFixtures;
import com.wellnessplatform.common.model.Category;
import com.wellnessplatform.common.model.DecisionAction;
import com.wellnessplatform.common.model.StateSnapshot;
import com.wellnessplatform.common.model.StressLevel;
import com.wellnessplatform.common.model.TradeOffDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.wellnessplatform.common.HistoryFixtures.daysAgo;
import static com.wellnessplatform.common.HistoryFixtures.decision;
import static com.wellnessplatform.common.HistoryFixtures.entry;
import static org.junit.jupiter.api.Assertions.*;

class BurnoutPredictorTest {

    private final BurnoutPredictor predictor = new BurnoutPredictor(HistoryFixtures.CLOCK);

    /** One entry per day, oldest first, ending today. */
    private static List<TradeOffDecision> daily(List<StateSnapshot> states, DecisionAction recoveryAction) {
        List<TradeOffDecision> history = new ArrayList<>();
        for (int i = 0; i < states.size(); i++) {
            history.add(entry(daysAgo(states.size() - 1 - i), states.get(i), List.of(),
                decision(Category.RECOVERY, recoveryAction)));
        }
        return history;
    }

    @Nested
    @DisplayName("predict(): data sufficiency")
    class SufficiencyTests {

        @Test
        @DisplayName("empty history → score 10, low, insufficient data")
        void empty() {
            BurnoutForecast forecast = predictor.predict(List.of());
            assertEquals(10, forecast.riskScore());
            assertEquals(BurnoutSeverity.LOW, forecast.severity());
            assertEquals(List.of("Insufficient data for analysis"), forecast.primaryFactors());
            assertNull(forecast.daysToCrisis());
            assertFalse(forecast.interventionNeeded());
        }

        @Test
        @DisplayName("entries older than 7 days are ignored")
        void staleEntriesIgnored() {
            StateSnapshot exhausted = StateSnapshot.of(4.0, 2, StressLevel.HIGH, 1.0);
            List<TradeOffDecision> history = List.of(
                entry(daysAgo(12), exhausted, List.of()),
                entry(daysAgo(10), exhausted, List.of()),
                entry(daysAgo(8),  exhausted, List.of()),
                entry(daysAgo(1),  exhausted, List.of()));
            assertEquals(10, predictor.predict(history).riskScore());
        }
    }

    @Nested
    @DisplayName("predict(): scoring")
    class ScoringTests {

        @Test
        @DisplayName("a healthy week → score 0 with no significant factors")
        void healthyWeek() {
            List<StateSnapshot> states = new ArrayList<>();
            for (int i = 0; i < 5; i++) states.add(StateSnapshot.of(8.0, 7, StressLevel.LOW, 2.0));

            BurnoutForecast forecast = predictor.predict(daily(states, DecisionAction.MAINTAIN));
            assertEquals(0, forecast.riskScore());
            assertEquals(BurnoutSeverity.LOW, forecast.severity());
            assertEquals(List.of("No significant risk factors"), forecast.primaryFactors());
        }

        @Test
        @DisplayName("short nights, constant high stress, skipped recovery, falling energy → critical at 83")
        void criticalWeek() {
            int[] energy = {10, 8, 6, 4, 2, 1, 1};
            List<StateSnapshot> states = new ArrayList<>();
            for (int e : energy) states.add(StateSnapshot.of(5.0, e, StressLevel.HIGH, 2.0));

            BurnoutForecast forecast = predictor.predict(daily(states, DecisionAction.SKIP));
            assertEquals(83, forecast.riskScore());
            assertEquals(BurnoutSeverity.CRITICAL, forecast.severity());
            assertEquals(2, forecast.daysToCrisis());
            assertTrue(forecast.interventionNeeded());
            assertEquals(List.of("Sleep debt accumulation", "Chronic stress pattern", "Insufficient recovery"),
                forecast.primaryFactors());
        }
    }

    @Nested
    @DisplayName("sub-scores")
    class SubScoreTests {

        @Test
        @DisplayName("sleep: mean 6.8h and two sub-6h nights in a row → 20 + 30")
        void sleepRisk() {
            List<TradeOffDecision> history = daily(List.of(
                StateSnapshot.of(8.0, 7, StressLevel.LOW, 2.0),
                StateSnapshot.of(5.5, 7, StressLevel.LOW, 2.0),
                StateSnapshot.of(5.7, 7, StressLevel.LOW, 2.0),
                StateSnapshot.of(8.0, 7, StressLevel.LOW, 2.0)), DecisionAction.MAINTAIN);
            assertEquals(50, BurnoutPredictor.sleepRisk(history));
        }

        @Test
        @DisplayName("recovery: mindfulness skips count as recovery opportunities too")
        void recoveryIncludesMindfulness() {
            List<TradeOffDecision> history = List.of(
                entry(daysAgo(2), HistoryFixtures.rested(), List.of(),
                    decision(Category.MINDFULNESS, DecisionAction.SKIP),
                    decision(Category.RECOVERY, DecisionAction.MAINTAIN)),
                entry(daysAgo(1), HistoryFixtures.rested(), List.of(),
                    decision(Category.MINDFULNESS, DecisionAction.SKIP),
                    decision(Category.FITNESS, DecisionAction.SKIP)));
            // 2 skips out of 3 recovery-type decisions
            assertEquals(80, BurnoutPredictor.recoveryRisk(history));
        }

        @Test
        @DisplayName("energy: fewer than 3 entries → 0")
        void energyNeedsThreeEntries() {
            List<TradeOffDecision> history = daily(List.of(
                StateSnapshot.of(8.0, 9, StressLevel.LOW, 2.0),
                StateSnapshot.of(8.0, 1, StressLevel.LOW, 2.0)), DecisionAction.MAINTAIN);
            assertEquals(0, BurnoutPredictor.energyDeclineRisk(history));
        }

        @Test
        @DisplayName("days to crisis bands")
        void daysToCrisis() {
            assertNull(BurnoutPredictor.daysToCrisis(29));
            assertEquals(7, BurnoutPredictor.daysToCrisis(30));
            assertEquals(5, BurnoutPredictor.daysToCrisis(65));
            assertEquals(3, BurnoutPredictor.daysToCrisis(70));
            assertEquals(1, BurnoutPredictor.daysToCrisis(95));
        }
    }
}
