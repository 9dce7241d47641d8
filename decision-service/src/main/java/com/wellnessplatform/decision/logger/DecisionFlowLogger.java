package com.wellnessplatform.decision.logger;

import com.wellnessplatform.common.model.TradeOffDecision;
import com.wellnessplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Stage logging for decision cycles and council deliberations. Pure side-effects.
 *
 * <p>Decision stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}</li>
 *   <li>{@link #DECISION_CREATED}: constraints evaluated and the engine returned</li>
 *   <li>{@link #HISTORY_APPENDED}</li>
 *   <li>{@link #NARRATIVE_GENERATED}</li>
 * </ol>
 * Council stages: {@link #COUNCIL_DISPATCHED}, {@link #CONSENSUS_REACHED}.
 *
 * <pre>
 *     .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.CONSENSUS_REACHED))
 * </pre>
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String REQUEST_RECEIVED    = "REQUEST_RECEIVED";
    public static final String DECISION_CREATED    = "DECISION_CREATED";
    public static final String HISTORY_APPENDED    = "HISTORY_APPENDED";
    public static final String NARRATIVE_GENERATED = "NARRATIVE_GENERATED";
    public static final String COUNCIL_DISPATCHED  = "COUNCIL_DISPATCHED";
    public static final String CONSENSUS_REACHED   = "CONSENSUS_REACHED";

    /**
     * {@code doOnEach} consumer reading the traceId from the Reactor Context.
     * Fires on {@code onNext} only.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[DecisionFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[DecisionFlow] stage={} traceId={}", stageName, traceId)
        );
    }

    /** One-line summary of a finished decision, keyed by its id. */
    public void logDecision(TradeOffDecision decision) {
        TraceContextUtil.withMdc(decision.decisionId(), () ->
            log.info("[DecisionFlow] stage={} constraints={} decisions={} impacts={} confidence={} traceId={}",
                     DECISION_CREATED,
                     decision.constraintsActive(),
                     decision.decisions().size(),
                     decision.futureImpacts().size(),
                     String.format("%.2f", decision.confidenceScore()),
                     decision.decisionId())
        );
    }
}
