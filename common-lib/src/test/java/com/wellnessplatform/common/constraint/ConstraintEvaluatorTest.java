package com.wellnessplatform.common.constraint;

import com.wellnessplatform.common.model.ActiveConstraints;
import com.wellnessplatform.common.model.ConstraintType;
import com.wellnessplatform.common.model.StateSnapshot;
import com.wellnessplatform.common.model.StressLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link ConstraintEvaluator} against the default thresholds.
 */
class ConstraintEvaluatorTest {

    private final ConstraintEvaluator evaluator = new ConstraintEvaluator();

    // ── Single dimensions ──────────────────────────────────────────

    @Nested
    @DisplayName("evaluate(): single dimensions")
    class SingleDimensionTests {

        @Test
        @DisplayName("rested, relaxed, plenty of time → no constraints")
        void healthyState_noConstraints() {
            ActiveConstraints result = evaluator.evaluate(StateSnapshot.of(8.0, 8, StressLevel.LOW, 3.0));
            assertTrue(result.isEmpty());
        }

        @Test
        @DisplayName("sleep below 5h → critical_sleep at 0.9, never low_sleep as well")
        void criticalSleep() {
            ActiveConstraints result = evaluator.evaluate(StateSnapshot.of(4.5, 8, StressLevel.LOW, 3.0));
            assertTrue(result.has(ConstraintType.CRITICAL_SLEEP));
            assertFalse(result.has(ConstraintType.LOW_SLEEP));
            assertEquals(0.9, result.severityOf(ConstraintType.CRITICAL_SLEEP), 1e-9);
        }

        @Test
        @DisplayName("sleep 5.5h → low_sleep with graded severity 1 - 5.5/6")
        void lowSleep_gradedSeverity() {
            ActiveConstraints result = evaluator.evaluate(StateSnapshot.of(5.5, 8, StressLevel.LOW, 3.0));
            assertEquals(List.of(ConstraintType.LOW_SLEEP), result.names());
            assertEquals(1.0 - 5.5 / 6.0, result.severityOf(ConstraintType.LOW_SLEEP), 1e-9);
        }

        @Test
        @DisplayName("energy 3 → low_energy 0.5; energy 2 → critical_energy 0.9")
        void energyBands() {
            assertEquals(0.5, evaluator.evaluate(StateSnapshot.of(8.0, 3, StressLevel.LOW, 3.0))
                .severityOf(ConstraintType.LOW_ENERGY), 1e-9);
            ActiveConstraints critical = evaluator.evaluate(StateSnapshot.of(8.0, 2, StressLevel.LOW, 3.0));
            assertTrue(critical.has(ConstraintType.CRITICAL_ENERGY));
            assertFalse(critical.has(ConstraintType.LOW_ENERGY));
        }

        @Test
        @DisplayName("only HIGH stress raises high_stress")
        void stress() {
            assertFalse(evaluator.evaluate(StateSnapshot.of(8.0, 8, StressLevel.MEDIUM, 3.0))
                .has(ConstraintType.HIGH_STRESS));
            assertEquals(0.7, evaluator.evaluate(StateSnapshot.of(8.0, 8, StressLevel.HIGH, 3.0))
                .severityOf(ConstraintType.HIGH_STRESS), 1e-9);
        }

        @Test
        @DisplayName("0.25h → time_critical; exactly 0.5h → time_limited")
        void timeBands() {
            assertTrue(evaluator.evaluate(StateSnapshot.of(8.0, 8, StressLevel.LOW, 0.25))
                .has(ConstraintType.TIME_CRITICAL));
            ActiveConstraints limited = evaluator.evaluate(StateSnapshot.of(8.0, 8, StressLevel.LOW, 0.5));
            assertTrue(limited.has(ConstraintType.TIME_LIMITED));
            assertEquals(1.0 - 0.5 / 1.5, limited.severityOf(ConstraintType.TIME_LIMITED), 1e-9);
        }

        @Test
        @DisplayName("sleep debt 6h → critical band 0.8; 3h → warning band 0.5")
        void sleepDebt() {
            StateSnapshot critical = new StateSnapshot(8.0, 8, StressLevel.LOW, 3.0, 6.0, 0);
            StateSnapshot warning  = new StateSnapshot(8.0, 8, StressLevel.LOW, 3.0, 3.0, 0);
            assertEquals(0.8, evaluator.evaluate(critical).severityOf(ConstraintType.SLEEP_DEBT_ACCUMULATED), 1e-9);
            assertEquals(0.5, evaluator.evaluate(warning).severityOf(ConstraintType.SLEEP_DEBT_ACCUMULATED), 1e-9);
        }

        @Test
        @DisplayName("3 consecutive high-effort days → overtraining_risk")
        void overtraining() {
            StateSnapshot state = new StateSnapshot(8.0, 8, StressLevel.LOW, 3.0, 0.0, 3);
            assertTrue(evaluator.evaluate(state).has(ConstraintType.OVERTRAINING_RISK));
        }
    }

    // ── Compound ───────────────────────────────────────────────────

    @Nested
    @DisplayName("evaluate(): burnout compound rule")
    class CompoundTests {

        @Test
        @DisplayName("sleep + energy + stress → burnout_warning, appended last")
        void threeFactors_burnout() {
            ActiveConstraints result = evaluator.evaluate(StateSnapshot.of(4.5, 3, StressLevel.HIGH, 2.0));
            assertEquals(List.of(ConstraintType.CRITICAL_SLEEP, ConstraintType.LOW_ENERGY,
                ConstraintType.HIGH_STRESS, ConstraintType.BURNOUT_WARNING), result.names());
        }

        @Test
        @DisplayName("two factors are not enough")
        void twoFactors_noBurnout() {
            ActiveConstraints result = evaluator.evaluate(StateSnapshot.of(4.5, 8, StressLevel.HIGH, 2.0));
            assertFalse(result.has(ConstraintType.BURNOUT_WARNING));
        }

        @Test
        @DisplayName("burnout_warning present iff at least 3 of the 4 signals, over all 16 combinations")
        void allSignalCombinations() {
            for (int mask = 0; mask < 16; mask++) {
                boolean sleep  = (mask & 1) != 0;
                boolean energy = (mask & 2) != 0;
                boolean stress = (mask & 4) != 0;
                boolean effort = (mask & 8) != 0;
                StateSnapshot state = new StateSnapshot(
                    sleep ? 4.0 : 8.0,
                    energy ? 2 : 8,
                    stress ? StressLevel.HIGH : StressLevel.LOW,
                    3.0, 0.0,
                    effort ? 4 : 0);

                int signals = Integer.bitCount(mask);
                assertEquals(signals >= 3, evaluator.evaluate(state).has(ConstraintType.BURNOUT_WARNING),
                    "signals=" + signals + " mask=" + mask);
            }
        }

        @Test
        @DisplayName("every severity lies within [0, 1]")
        void severitiesBounded() {
            ActiveConstraints result = evaluator.evaluate(new StateSnapshot(0.0, 1, StressLevel.HIGH, 0.0, 20.0, 10));
            result.asList().forEach(c -> assertTrue(c.severity() >= 0.0 && c.severity() <= 1.0));
        }
    }

    // ── summarize() ────────────────────────────────────────────────

    @Nested
    @DisplayName("summarize()")
    class SummarizeTests {

        @Test
        @DisplayName("empty set → full adherence message")
        void empty() {
            assertEquals("No active constraints - full adherence possible",
                ConstraintEvaluator.summarize(ActiveConstraints.none()));
        }

        @Test
        @DisplayName("most severe constraint listed first with its label")
        void orderedBySeverity() {
            String summary = ConstraintEvaluator.summarize(
                evaluator.evaluate(StateSnapshot.of(5.5, 8, StressLevel.HIGH, 3.0)));
            String[] lines = summary.split("\n");
            assertEquals("Active Constraints:", lines[0]);
            assertTrue(lines[1].startsWith("  [HIGH] high_stress:"));
            assertTrue(lines[2].startsWith("  [MODERATE] low_sleep:"));
        }
    }
}
