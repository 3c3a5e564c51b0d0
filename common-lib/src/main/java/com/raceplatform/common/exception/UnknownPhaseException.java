package com.raceplatform.common.exception;

public class UnknownPhaseException extends PipelineException {
    private final String rawPhase;

    public UnknownPhaseException(String rawPhase) {
        super("Phase", "unrecognised phase '" + rawPhase + "' (expected H30, H5 or RESULT)");
        this.rawPhase = rawPhase;
    }

    public String getRawPhase() {
        return rawPhase;
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
