package com.raceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Settlement of one H5 ticket against the official arrival.
 */
public record TicketOutcome(
    @JsonProperty("kind")    BetKind kind,
    @JsonProperty("runners") List<String> runners,
    @JsonProperty("stake")   BigDecimal stake,
    @JsonProperty("won")     boolean won,
    @JsonProperty("payout")  BigDecimal payout
) {}
