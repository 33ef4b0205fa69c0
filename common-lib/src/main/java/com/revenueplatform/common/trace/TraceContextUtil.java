package com.revenueplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries a run's trace id through reactive pipelines.
 *
 * <p>The Reactor Context holds the id. MDC is written only for the duration of a single
 * log statement via {@link #withMdc}.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(pipeline, request.traceId());
 *     ...
 *     signal -> TraceContextUtil.getTraceId(signal.getContextView())
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String UNKNOWN      = "unknown";

    private TraceContextUtil() {}

    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    /** Returns {@code traceId} unless blank, in which case a fresh id is generated. */
    public static String orNew(String traceId) {
        return traceId == null || traceId.isBlank() ? newTraceId() : traceId;
    }

    /** Call at the end of pipeline assembly; {@code contextWrite} propagates upstream. */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** @return the trace id, or {@value #UNKNOWN}; never null */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /** Puts {@code traceId} in MDC for {@code logAction} only. */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
