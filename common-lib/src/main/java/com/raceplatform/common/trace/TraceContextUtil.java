package com.raceplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.Map;
import java.util.Optional;

/**
 * Carries the {@link RaceTrace} of a phase invocation through the Reactor Context.
 *
 * <p>The Reactor Context is the only store. MDC receives the trace fields only while one log
 * statement runs ({@link #withMdc}), and whatever MDC held before is put back afterwards.
 *
 * <pre>
 *     return TraceContextUtil.withRaceTrace(pipeline, trace);
 *     ...
 *     .doOnEach(signal -> TraceContextUtil.currentTrace(signal.getContextView()))
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String MEETING_KEY  = "meetingId";
    public static final String RACE_KEY     = "raceId";
    public static final String PHASE_KEY    = "phase";

    static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /**
     * Stores {@code trace} in the Reactor Context. {@code contextWrite} applies upstream, so
     * call this last when assembling the pipeline.
     */
    public static <T> Mono<T> withRaceTrace(Mono<T> mono, RaceTrace trace) {
        return mono.contextWrite(ctx -> ctx.put(RaceTrace.class, trace).put(TRACE_ID_KEY, trace.traceId()));
    }

    public static Optional<RaceTrace> currentTrace(ContextView ctx) {
        return ctx.getOrEmpty(RaceTrace.class);
    }

    /** Trace id of the invocation in {@code ctx}, or {@code "unknown"} outside one. */
    public static String getTraceId(ContextView ctx) {
        return currentTrace(ctx).map(RaceTrace::traceId).orElse(UNKNOWN);
    }

    /**
     * Runs {@code logAction} with the trace fields in MDC. A {@code null} trace logs without them.
     */
    public static void withMdc(RaceTrace trace, Runnable logAction) {
        if (trace == null) {
            logAction.run();
            return;
        }
        Map<String, String> previous = MDC.getCopyOfContextMap();
        trace.mdcFields().forEach(MDC::put);
        try {
            logAction.run();
        } finally {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
