package com.raceplatform.orchestrator.logger;

import com.raceplatform.common.model.Decision;
import com.raceplatform.common.trace.RaceTrace;
import com.raceplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs the lifecycle of one phase invocation. Pure side effects, no business logic.
 *
 * <ol>
 *   <li>{@link #TRIGGER_RECEIVED}    phase triggered by the scheduler or the API</li>
 *   <li>{@link #INPUTS_FETCHED}      snapshot, calibration, enrichment and result fetches settled</li>
 *   <li>{@link #DECISION_CREATED}    engine returned the artifact</li>
 *   <li>{@link #ARTIFACT_DISPATCHED} artifact recorded and handed to the sink</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.INPUTS_FETCHED))
 * </pre>
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String TRIGGER_RECEIVED    = "TRIGGER_RECEIVED";
    public static final String INPUTS_FETCHED      = "INPUTS_FETCHED";
    public static final String DECISION_CREATED    = "DECISION_CREATED";
    public static final String ARTIFACT_DISPATCHED = "ARTIFACT_DISPATCHED";

    /**
     * {@code doOnEach} consumer logging {@code stageName} on {@code onNext} only. The race trace
     * is read from the Reactor Context carried by the signal.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            RaceTrace trace = TraceContextUtil.currentTrace(signal.getContextView()).orElse(null);
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(trace, () ->
                log.info("[DecisionFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logStage(String stageName, RaceTrace trace) {
        TraceContextUtil.withMdc(trace, () ->
            log.info("[DecisionFlow] stage={} traceId={}", stageName, trace.traceId())
        );
    }

    /** One-line summary of an emitted decision. */
    public void logDecision(Decision decision) {
        RaceTrace trace = RaceTrace.of(decision);
        TraceContextUtil.withMdc(trace, () ->
            log.info("[DecisionFlow] stage={} phase={} meeting={} race={} abstain={} tickets={} totalStake={} "
                     + "evGlobal={} overround={} codes={} traceId={}",
                     DECISION_CREATED, decision.phase(), decision.meetingId(), decision.raceId(), decision.abstain(),
                     decision.tickets().size(), decision.totalStake().toPlainString(),
                     decision.evGlobalEstimate(), decision.overround(), decision.reasonCodes(), trace.traceId())
        );
    }
}
