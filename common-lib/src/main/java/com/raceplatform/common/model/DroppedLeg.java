package com.raceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A candidate leg that did not become a ticket, with the reason.
 */
public record DroppedLeg(
    @JsonProperty("kind")    BetKind kind,
    @JsonProperty("runners") List<String> runners,
    @JsonProperty("reason")  RejectionReason reason
) {}
