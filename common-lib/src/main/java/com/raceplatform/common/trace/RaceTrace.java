package com.raceplatform.common.trace;

import com.raceplatform.common.model.Decision;
import com.raceplatform.common.model.Phase;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identity of one phase invocation as it appears in logs and outbound headers.
 * {@link #traceId()} is deterministic, so a re-run of the same phase logs under the same id.
 */
public record RaceTrace(String meetingId, String raceId, Phase phase) {

    public static RaceTrace of(Decision decision) {
        return new RaceTrace(decision.meetingId(), decision.raceId(), decision.phase());
    }

    public String traceId() {
        return meetingId + ":" + raceId + ":" + phase;
    }

    /** MDC fields, in log-pattern order. */
    public Map<String, String> mdcFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(TraceContextUtil.TRACE_ID_KEY, traceId());
        fields.put(TraceContextUtil.MEETING_KEY, meetingId);
        fields.put(TraceContextUtil.RACE_KEY, raceId);
        fields.put(TraceContextUtil.PHASE_KEY, String.valueOf(phase));
        return fields;
    }
}
