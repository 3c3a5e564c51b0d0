package com.raceplatform.orchestrator.guard;

import com.raceplatform.common.exception.PipelineException;
import com.raceplatform.common.model.Phase;

/**
 * A second invocation of the same phase for the same race arrived while the first was still
 * running. Mapped to HTTP 409.
 */
public class ConcurrentInvocationException extends PipelineException {

    public ConcurrentInvocationException(String meetingId, String raceId, Phase phase) {
        super("InvocationGuard", "phase " + phase + " already running for meeting " + meetingId + " race " + raceId);
    }
}
