package com.wellnessplatform.decision.service;

import com.wellnessplatform.common.burnout.BurnoutForecast;
import com.wellnessplatform.common.burnout.BurnoutPredictor;
import com.wellnessplatform.common.model.PlannedTask;
import com.wellnessplatform.common.model.StateSnapshot;
import com.wellnessplatform.common.model.TradeOffDecision;
import com.wellnessplatform.common.pattern.PatternDetector;
import com.wellnessplatform.common.pattern.PatternReport;
import com.wellnessplatform.common.pattern.PlanAdjuster;
import com.wellnessplatform.common.pattern.PlanAdjustment;
import com.wellnessplatform.common.temporal.TemporalInsight;
import com.wellnessplatform.common.temporal.TemporalReasoner;
import com.wellnessplatform.decision.repository.HealthDataRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

/** History-driven insights: burnout risk, weekly patterns, temporal reasoning, plan adjustment. */
@Service
public class InsightService {

    private static final Logger log = LoggerFactory.getLogger(InsightService.class);

    private final HealthDataRepository repository;
    private final BurnoutPredictor burnoutPredictor;
    private final TemporalReasoner temporalReasoner;
    private final PlanAdjuster planAdjuster;
    private final Clock clock;
    private final int windowDays;

    public InsightService(HealthDataRepository repository,
                          BurnoutPredictor burnoutPredictor,
                          TemporalReasoner temporalReasoner,
                          PlanAdjuster planAdjuster,
                          Clock clock,
                          @Value("${engine.pattern.window-days:7}") int windowDays) {
        this.repository       = repository;
        this.burnoutPredictor = burnoutPredictor;
        this.temporalReasoner = temporalReasoner;
        this.planAdjuster     = planAdjuster;
        this.clock            = clock;
        this.windowDays       = windowDays;
    }

    public Mono<BurnoutForecast> burnout() {
        return Mono.fromCallable(() -> burnoutPredictor.predict(repository.history()))
            .doOnNext(f -> log.info("[Insights] Burnout forecast. riskScore={} severity={} daysToCrisis={}",
                                    f.riskScore(), f.severity(), f.daysToCrisis()));
    }

    public Mono<PatternReport> patterns() {
        return Mono.fromCallable(() -> new PatternDetector(repository.history(), clock, windowDays)
                .weeklyReport(repository.adaptations().size()))
            .doOnNext(r -> log.info("[Insights] Weekly report. status={} totalDecisions={} recommendations={}",
                                    r.status(), r.totalDecisions(), r.recommendations().size()));
    }

    public Mono<TemporalInsight> temporal(StateSnapshot state) {
        return Mono.fromCallable(() -> temporalReasoner.analyze(repository.history(), state))
            .doOnNext(t -> log.info("[Insights] Temporal analysis. patterns={} riskLevel={} urgency={}",
                                    t.pastPatterns().size(), t.presentContext().riskLevel(), t.urgencyLevel()));
    }

    /**
     * Adjusts {@code upcomingTasks} against the latest stored decision. With an empty
     * history only pattern rules could apply, and those need three entries, so the
     * tasks come back unchanged.
     */
    public Mono<PlanAdjustment> adjustPlan(List<PlannedTask> upcomingTasks) {
        return Mono.fromCallable(() -> {
                List<TradeOffDecision> history = repository.history();
                TradeOffDecision latest = history.isEmpty() ? null : history.get(history.size() - 1);
                PlanAdjustment adjustment = planAdjuster.adjustFuturePlan(latest, upcomingTasks, history);
                repository.appendAdaptations(adjustment.records());
                return adjustment;
            })
            .doOnNext(a -> log.info("[Insights] Plan adjusted. tasks={} adaptations={}",
                                    a.tasks().size(), a.records().size()));
    }
}
