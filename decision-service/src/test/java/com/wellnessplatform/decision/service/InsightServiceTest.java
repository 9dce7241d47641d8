package com.wellnessplatform.decision.service;

import com.wellnessplatform.common.burnout.BurnoutPredictor;
import com.wellnessplatform.common.burnout.BurnoutSeverity;
import com.wellnessplatform.common.model.Category;
import com.wellnessplatform.common.model.DecisionAction;
import com.wellnessplatform.common.model.FutureImpact;
import com.wellnessplatform.common.model.PlannedTask;
import com.wellnessplatform.common.model.TradeOffDecision;
import com.wellnessplatform.common.pattern.PatternReport;
import com.wellnessplatform.common.pattern.PlanAdjuster;
import com.wellnessplatform.common.temporal.RiskLevel;
import com.wellnessplatform.common.temporal.TemporalReasoner;
import com.wellnessplatform.decision.TestDecisions;
import com.wellnessplatform.decision.repository.InMemoryHealthDataRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wires the real analyzers against an in-memory repository and a fixed clock.
 */
class InsightServiceTest {

    private InMemoryHealthDataRepository repository;
    private InsightService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryHealthDataRepository(50);
        service = new InsightService(repository,
            new BurnoutPredictor(TestDecisions.CLOCK),
            new TemporalReasoner(TestDecisions.CLOCK),
            new PlanAdjuster(TestDecisions.CLOCK),
            TestDecisions.CLOCK,
            7);
    }

    @Test
    @DisplayName("burnout on an empty history → insufficient data forecast")
    void burnout_empty() {
        StepVerifier.create(service.burnout())
            .assertNext(f -> {
                assertEquals(10, f.riskScore());
                assertEquals(BurnoutSeverity.LOW, f.severity());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("patterns report counts logged adaptations")
    void patterns_countsAdaptations() {
        for (int i = 0; i < 4; i++) {
            repository.append(TestDecisions.decision("d" + i, 4 - i, DecisionAction.SKIP));
        }
        StepVerifier.create(service.adjustPlan(List.of(TestDecisions.task(Category.FITNESS, "Run", 40))))
            .expectNextCount(1)
            .verifyComplete();

        StepVerifier.create(service.patterns())
            .assertNext(report -> {
                assertEquals(PatternReport.Status.OK, report.status());
                assertEquals(4, report.totalDecisions());
                assertEquals(repository.adaptations().size(), report.adaptationsMade());
                assertEquals(100.0, report.categories().get(Category.FITNESS).skipRate(), 1e-9);
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("plan adjustment uses the latest decision and logs its records")
    void adjustPlan_latestDecision() {
        repository.append(new TradeOffDecision("today", TestDecisions.NOW, TestDecisions.rested(), List.of(),
            Map.of(), List.of(),
            List.of(new FutureImpact(7, FutureImpact.DELOAD_WEEK, "deload")), 0.7, ""));
        PlannedTask run = new PlannedTask(Category.FITNESS, "Run", 40, 0.8, "");

        StepVerifier.create(service.adjustPlan(List.of(run)))
            .assertNext(adjustment -> {
                assertEquals(0.4, adjustment.tasks().get(0).intensity(), 1e-9);
                assertEquals(1, adjustment.records().size());
            })
            .verifyComplete();
        assertEquals("high_fatigue_signals", repository.adaptations().get(0).patternDetected());
    }

    @Test
    @DisplayName("plan adjustment with no history returns the tasks unchanged")
    void adjustPlan_noHistory() {
        List<PlannedTask> upcoming = List.of(TestDecisions.task(Category.NUTRITION, "Meal prep", 30));
        StepVerifier.create(service.adjustPlan(upcoming))
            .assertNext(adjustment -> {
                assertEquals(upcoming, adjustment.tasks());
                assertTrue(adjustment.records().isEmpty());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("temporal analysis reads the present state")
    void temporal() {
        StepVerifier.create(service.temporal(TestDecisions.rested()))
            .assertNext(insight -> assertEquals(RiskLevel.LOW, insight.presentContext().riskLevel()))
            .verifyComplete();
    }
}
