package com.wellnessplatform.common.council;

/**
 * A council seat. Implementations must not keep mutable state: the service
 * evaluates all agents of one deliberation concurrently.
 */
public interface CouncilAgent {
    AgentRecommendation recommend(CouncilContext context);
    AgentRole role();
}
