package com.wellnessplatform.common.negotiator;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Verdict on a user goal. {@code counterProposal} is {@code null} when the goal is accepted;
 * {@code safetyScore} is clamped to [0.0, 1.0].
 */
public record NegotiationResult(
    @JsonProperty("status")          NegotiationStatus status,
    @JsonProperty("counterProposal") String counterProposal,
    @JsonProperty("reasoning")       String reasoning,
    @JsonProperty("safetyScore")     double safetyScore
) {
    public NegotiationResult {
        safetyScore = Math.max(0.0, Math.min(1.0, safetyScore));
        reasoning   = reasoning != null ? reasoning : "";
    }

    public boolean accepted() {
        return status == NegotiationStatus.ACCEPTED;
    }
}
