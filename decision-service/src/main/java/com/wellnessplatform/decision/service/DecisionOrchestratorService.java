package com.wellnessplatform.decision.service;

import com.wellnessplatform.common.constraint.ConstraintEvaluator;
import com.wellnessplatform.common.model.ActiveConstraints;
import com.wellnessplatform.common.model.PlannedTask;
import com.wellnessplatform.common.model.StateSnapshot;
import com.wellnessplatform.common.model.TradeOffDecision;
import com.wellnessplatform.common.model.UserProfile;
import com.wellnessplatform.common.tradeoff.TradeOffEngine;
import com.wellnessplatform.decision.dto.DecisionResponse;
import com.wellnessplatform.decision.dto.HealthStatusDTO;
import com.wellnessplatform.decision.logger.DecisionFlowLogger;
import com.wellnessplatform.decision.narrative.NarrativeGenerator;
import com.wellnessplatform.decision.repository.HealthDataRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Runs one decision cycle: evaluate constraints, decide with the profile's preferences,
 * append to history, then attach the narrative.
 *
 * <p>The decision is stored before narrative generation, so a slow or failed narrative
 * never loses a decision.
 */
@Service
public class DecisionOrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(DecisionOrchestratorService.class);

    private final ConstraintEvaluator constraintEvaluator;
    private final TradeOffEngine tradeOffEngine;
    private final HealthDataRepository repository;
    private final NarrativeGenerator narrativeGenerator;
    private final DecisionFlowLogger flowLogger;

    public DecisionOrchestratorService(ConstraintEvaluator constraintEvaluator,
                                       TradeOffEngine tradeOffEngine,
                                       HealthDataRepository repository,
                                       NarrativeGenerator narrativeGenerator,
                                       DecisionFlowLogger flowLogger) {
        this.constraintEvaluator = constraintEvaluator;
        this.tradeOffEngine      = tradeOffEngine;
        this.repository          = repository;
        this.narrativeGenerator  = narrativeGenerator;
        this.flowLogger          = flowLogger;
    }

    public Mono<DecisionResponse> decide(StateSnapshot state, List<PlannedTask> tasks) {
        return Mono.fromCallable(() -> {
                UserProfile profile = repository.profile();
                ActiveConstraints constraints = constraintEvaluator.evaluate(state);
                TradeOffDecision decision = tradeOffEngine
                    .withPreferences(profile.preferences())
                    .decide(state, constraints, tasks);
                flowLogger.logDecision(decision);

                repository.append(decision);
                flowLogger.logWithTraceId(DecisionFlowLogger.HISTORY_APPENDED, decision.decisionId());
                return new Cycle(decision, ConstraintEvaluator.summarize(constraints));
            })
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(cycle -> narrativeGenerator.narrate(cycle.decision())
                .doOnNext(n -> flowLogger.logWithTraceId(DecisionFlowLogger.NARRATIVE_GENERATED,
                                                         cycle.decision().decisionId()))
                .map(narrative -> new DecisionResponse(cycle.decision(), cycle.constraintSummary(), narrative)))
            .doOnError(e -> log.error("[DecisionFlow] Decision cycle failed. tasks={}",
                                      tasks != null ? tasks.size() : 0, e));
    }

    public Mono<List<TradeOffDecision>> history() {
        return Mono.fromCallable(repository::history);
    }

    public Mono<Void> clearHistory() {
        return Mono.fromRunnable(() -> {
            repository.clearHistory();
            log.info("[DecisionFlow] History cleared");
        });
    }

    public Mono<HealthStatusDTO> health() {
        return Mono.fromCallable(() -> new HealthStatusDTO("UP", repository.history().size(),
            repository.maxHistorySize(), narrativeGenerator.mode()));
    }

    private record Cycle(TradeOffDecision decision, String constraintSummary) {}
}
