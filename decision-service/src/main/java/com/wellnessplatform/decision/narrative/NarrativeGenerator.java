package com.wellnessplatform.decision.narrative;

import com.wellnessplatform.common.model.TradeOffDecision;
import reactor.core.publisher.Mono;

/**
 * Turns a finished decision into user-facing prose. Implementations only read the
 * decision and must never emit an error: a failed generation falls back to text.
 */
public interface NarrativeGenerator {
    Mono<String> narrate(TradeOffDecision decision);
    String mode();
}
