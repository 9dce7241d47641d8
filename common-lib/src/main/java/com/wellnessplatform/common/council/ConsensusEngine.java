package com.wellnessplatform.common.council;

import java.util.List;

/**
 * Strategy contract for reducing council votes to one decision.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to call concurrently</li>
 *   <li><b>Order-independent</b>: the same votes in any arrival order give the same result</li>
 *   <li><b>Non-null</b>: always return a valid {@link ConsensusDecision}</li>
 * </ul>
 *
 * <p>Current implementation: {@link WeightedConsensusStrategy}. Swap it by registering a
 * different {@code @Bean} in the service configuration.
 */
public interface ConsensusEngine {

    /**
     * @param votes agent recommendations in any order; may be empty
     * @return a {@link ConsensusDecision}, never {@code null}
     */
    ConsensusDecision compute(List<AgentRecommendation> votes);
}
