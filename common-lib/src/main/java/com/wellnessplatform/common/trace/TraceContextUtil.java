package com.wellnessplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Reactive trace propagation. The Reactor Context holds the traceId (the decision id
 * for a decision cycle, a fresh id for other requests). MDC is written only for the
 * duration of a single log statement.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(pipeline, traceId);
 *     ...
 *     signal -> TraceContextUtil.getTraceId(signal.getContextView())
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";

    private TraceContextUtil() {}

    /** Stores {@code traceId} in the Reactor Context. Apply at the end of pipeline assembly. */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** The traceId from {@code ctx}, or {@code "unknown"}. Never {@code null}. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /**
     * Puts {@code traceId} into MDC, runs {@code logAction}, then removes it.
     * Only for logging side-effects.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
