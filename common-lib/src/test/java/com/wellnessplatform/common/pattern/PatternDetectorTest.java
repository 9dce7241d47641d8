package com.wellnessplatform.common.pattern;

import com.wellnessplatform.common.HistoryFixtures;
import com.wellnessplatform.common.model.Category;
import com.wellnessplatform.common.model.ConstraintType;
import com.wellnessplatform.common.model.DecisionAction;
import com.wellnessplatform.common.model.TradeOffDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;

import static com.wellnessplatform.common.HistoryFixtures.daysAgo;
import static com.wellnessplatform.common.HistoryFixtures.decision;
import static com.wellnessplatform.common.HistoryFixtures.entry;
import static org.junit.jupiter.api.Assertions.*;

class PatternDetectorTest {

    /** Seven daily entries ending today; mindfulness skipped on the first five. */
    static List<TradeOffDecision> mindfulnessSkippedWeek() {
        List<TradeOffDecision> history = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            DecisionAction mindfulness = i < 5 ? DecisionAction.SKIP : DecisionAction.MAINTAIN;
            history.add(entry(daysAgo(6 - i), HistoryFixtures.rested(), List.of(ConstraintType.HIGH_STRESS),
                decision(Category.MINDFULNESS, mindfulness),
                decision(Category.FITNESS, DecisionAction.DOWNGRADE)));
        }
        return history;
    }

    @Nested
    @DisplayName("frequencies")
    class FrequencyTests {

        @Test
        @DisplayName("5 mindfulness skips over 7 entries → 5/7")
        void skipFrequency() {
            PatternDetector detector = new PatternDetector(mindfulnessSkippedWeek(), HistoryFixtures.CLOCK);
            assertEquals(5.0 / 7.0, detector.skipFrequency(Category.MINDFULNESS), 1e-9);
            assertEquals(0.0, detector.skipFrequency(Category.NUTRITION), 1e-9);
            assertEquals(1.0, detector.downgradeFrequency(Category.FITNESS), 1e-9);
        }

        @Test
        @DisplayName("entries older than the window do not count")
        void windowExcludesOldEntries() {
            List<TradeOffDecision> history = new ArrayList<>();
            history.add(entry(daysAgo(20), HistoryFixtures.rested(), List.of(),
                decision(Category.FITNESS, DecisionAction.SKIP)));
            history.add(entry(daysAgo(1), HistoryFixtures.rested(), List.of(),
                decision(Category.FITNESS, DecisionAction.MAINTAIN)));

            PatternDetector detector = new PatternDetector(history, HistoryFixtures.CLOCK);
            assertEquals(1, detector.windowSize());
            assertEquals(0.0, detector.skipFrequency(Category.FITNESS), 1e-9);
        }

        @Test
        @DisplayName("empty history → zero frequencies")
        void empty() {
            PatternDetector detector = new PatternDetector(List.of(), HistoryFixtures.CLOCK);
            assertEquals(0.0, detector.skipFrequency(Category.FITNESS), 1e-9);
            assertTrue(detector.constraintCounts().isEmpty());
        }

        @Test
        @DisplayName("constraint counts and weekday breakdown")
        void countsAndBreakdown() {
            PatternDetector detector = new PatternDetector(mindfulnessSkippedWeek(), HistoryFixtures.CLOCK);
            assertEquals(7, detector.constraintCounts().get(ConstraintType.HIGH_STRESS));

            DayOfWeekStats monday = detector.dayOfWeekBreakdown().get(DayOfWeek.MONDAY);
            assertEquals(1, monday.decisions());
            assertEquals(1, monday.skips());
            assertEquals(1.0, monday.avgConstraints(), 1e-9);
        }
    }

    @Nested
    @DisplayName("weeklyReport()")
    class ReportTests {

        @Test
        @DisplayName("fewer than 3 entries → insufficient data")
        void insufficientData() {
            List<TradeOffDecision> history = mindfulnessSkippedWeek().subList(0, 2);
            PatternReport report = new PatternDetector(history, HistoryFixtures.CLOCK).weeklyReport();

            assertEquals(PatternReport.Status.INSUFFICIENT_DATA, report.status());
            assertEquals(2, report.totalDecisions());
            assertTrue(report.categories().isEmpty());
        }

        @Test
        @DisplayName("full week → percentages, recommendations and adaptation count")
        void fullReport() {
            PatternReport report = new PatternDetector(mindfulnessSkippedWeek(), HistoryFixtures.CLOCK)
                .weeklyReport(3);

            assertEquals(PatternReport.Status.OK, report.status());
            assertEquals("last_7_days", report.period());
            assertEquals(7, report.totalDecisions());
            assertEquals(71.4, report.categories().get(Category.MINDFULNESS).skipRate(), 1e-9);
            assertEquals(100.0, report.categories().get(Category.FITNESS).downgradeRate(), 1e-9);
            assertEquals(3, report.adaptationsMade());
            assertEquals(List.of(
                    "fitness frequently downgraded - consider adjusting default intensity",
                    "Consider reducing mindfulness targets - current plan may be too ambitious",
                    "High stress is frequent - consider adding more recovery buffers"),
                report.recommendations());
        }
    }
}
