package com.raceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One rejection: a stable code for machines and a note for the audit trail.
 */
public record RejectionReason(
    @JsonProperty("code") ReasonCode code,
    @JsonProperty("note") String note
) {
    public static RejectionReason of(ReasonCode code, String note) {
        return new RejectionReason(code, note);
    }
}
