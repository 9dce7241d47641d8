package com.wellnessplatform.decision.service;

import com.wellnessplatform.common.council.AgentRecommendation;
import com.wellnessplatform.common.council.ConsensusDecision;
import com.wellnessplatform.common.council.CouncilAgent;
import com.wellnessplatform.common.council.CouncilContext;
import com.wellnessplatform.common.council.HealthCouncil;
import com.wellnessplatform.common.exception.AgentException;
import com.wellnessplatform.common.model.StateSnapshot;
import com.wellnessplatform.common.trace.TraceContextUtil;
import com.wellnessplatform.decision.logger.DecisionFlowLogger;
import com.wellnessplatform.decision.repository.HealthDataRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.UUID;

/**
 * Evaluates the council agents in parallel and reduces their votes to one decision.
 * A failing agent is replaced by a zero-confidence vote so the council always answers.
 */
@Service
public class CouncilDispatchService {

    private static final Logger log = LoggerFactory.getLogger(CouncilDispatchService.class);

    private final HealthCouncil council;
    private final HealthDataRepository repository;
    private final DecisionFlowLogger flowLogger;

    public CouncilDispatchService(HealthCouncil council, HealthDataRepository repository,
                                  DecisionFlowLogger flowLogger) {
        this.council    = council;
        this.repository = repository;
        this.flowLogger = flowLogger;
    }

    public Mono<ConsensusDecision> deliberate(StateSnapshot state, String activity, String goal) {
        String traceId = UUID.randomUUID().toString();
        Mono<ConsensusDecision> pipeline = Mono.fromCallable(() -> {
                String effectiveGoal = goal != null && !goal.isBlank() ? goal : repository.profile().goal();
                return new CouncilContext(state, activity, effectiveGoal, repository.history());
            })
            .flatMap(this::dispatchAll)
            .doOnEach(flowLogger.stage(DecisionFlowLogger.COUNCIL_DISPATCHED))
            .map(council::consensus)
            .doOnEach(flowLogger.stage(DecisionFlowLogger.CONSENSUS_REACHED))
            .doOnNext(d -> log.info("[Council] Consensus reached. activity={} action={} level={} dissent={}",
                                    activity, d.finalAction(), String.format("%.2f", d.consensusLevel()),
                                    d.dissentingOpinions().size()));
        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    public Mono<List<AgentRecommendation>> dispatchAll(CouncilContext context) {
        log.info("[Council] Dispatching {} agents in parallel. activity={}", council.agents().size(),
                 context.activity());
        return Flux.fromIterable(council.agents())
            .flatMap(agent -> Mono.fromCallable(() -> recommend(agent, context))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSuccess(vote -> log.info("[Council] Agent={} complete. action={} confidence={}",
                    agent.role().wireName(), vote.action(), vote.confidence()))
                .onErrorResume(e -> {
                    log.error("[Council] Agent={} failed. activity={}", agent.role().wireName(),
                              context.activity(), e);
                    return Mono.just(AgentRecommendation.abstain(agent.role(), e.getMessage()));
                }))
            .collectList();
    }

    private static AgentRecommendation recommend(CouncilAgent agent, CouncilContext context) {
        try {
            return agent.recommend(context);
        } catch (RuntimeException e) {
            throw new AgentException(agent.role().displayName(), "recommendation failed: " + e.getMessage(), e);
        }
    }
}
