package com.wellnessplatform.common.council;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of one council deliberation.
 *
 * <ul>
 *   <li>{@code consensusLevel}: winning action's confidence share, in [0.0, 1.0]</li>
 *   <li>{@code votes}: every recommendation, in {@link AgentRole} declaration order</li>
 *   <li>{@code dissentingOpinions}: {@code "<role>: <reasoning>"} for each losing vote</li>
 * </ul>
 */
public record ConsensusDecision(
    @JsonProperty("finalAction")        CouncilAction finalAction,
    @JsonProperty("consensusLevel")     double consensusLevel,
    @JsonProperty("votes")              List<AgentRecommendation> votes,
    @JsonProperty("reasoningSummary")   String reasoningSummary,
    @JsonProperty("dissentingOpinions") List<String> dissentingOpinions
) {
    public ConsensusDecision {
        consensusLevel     = Math.max(0.0, Math.min(1.0, consensusLevel));
        votes              = votes != null ? List.copyOf(votes) : List.of();
        dissentingOpinions = dissentingOpinions != null ? List.copyOf(dissentingOpinions) : List.of();
    }
}
