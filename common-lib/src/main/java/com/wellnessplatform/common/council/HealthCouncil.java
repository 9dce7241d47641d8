package com.wellnessplatform.common.council;

import com.wellnessplatform.common.model.StateSnapshot;
import com.wellnessplatform.common.model.TradeOffDecision;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Four-seat health council. {@link #deliberate} runs the agents sequentially;
 * callers that want parallel evaluation use {@link #agents()} and {@link #consensus(List)}
 * directly, since consensus does not depend on vote order.
 */
public final class HealthCouncil {

    private final List<CouncilAgent> agents;
    private final ConsensusEngine consensusEngine;

    public HealthCouncil() {
        this(defaultAgents(), new WeightedConsensusStrategy());
    }

    public HealthCouncil(List<CouncilAgent> agents, ConsensusEngine consensusEngine) {
        this.agents          = List.copyOf(agents);
        this.consensusEngine = consensusEngine;
    }

    public static List<CouncilAgent> defaultAgents() {
        return List.of(
            new SleepSpecialistAgent(),
            new PerformanceCoachAgent(),
            new WellnessGuardianAgent(),
            new FutureSelfAgent());
    }

    public ConsensusDecision deliberate(StateSnapshot state, String activity, String goal,
                                        List<TradeOffDecision> history) {
        CouncilContext context = new CouncilContext(state, activity, goal, history);
        List<AgentRecommendation> votes = agents.stream()
            .map(agent -> agent.recommend(context))
            .collect(Collectors.toList());
        return consensus(votes);
    }

    public ConsensusDecision consensus(List<AgentRecommendation> votes) {
        return consensusEngine.compute(votes);
    }

    public List<CouncilAgent> agents() {
        return agents;
    }
}
