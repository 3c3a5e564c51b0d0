package com.raceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Capture instants of the mandatory snapshot inputs. A {@code null} entry means the input
 * was never captured and is treated as stale.
 */
public record InputTimestamps(
    @JsonProperty("odds")      Instant odds,
    @JsonProperty("runners")   Instant runners,
    @JsonProperty("scratches") Instant scratches
) {
    /** All inputs captured at the same instant. */
    public static InputTimestamps uniform(Instant capturedAt) {
        return new InputTimestamps(capturedAt, capturedAt, capturedAt);
    }
}
