package com.raceplatform.common.exception;

/**
 * A snapshot, calibration, enrichment or result feed could not be obtained. The pipeline
 * turns this into an abstention; callers may retry later with fresh data.
 */
public class DataUnavailableException extends PipelineException {
    private final String raceId;

    public DataUnavailableException(String raceId, String message) {
        super("DataSource", message + " (race=" + raceId + ")");
        this.raceId = raceId;
    }

    public DataUnavailableException(String raceId, String message, Throwable cause) {
        super("DataSource", message + " (race=" + raceId + ")", cause);
        this.raceId = raceId;
    }

    public String getRaceId() {
        return raceId;
    }
}
