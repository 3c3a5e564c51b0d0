package com.raceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Post-race tracking figures produced by the RESULT phase.
 *
 * @param outcomes    one entry per H5 ticket
 * @param totalStake  sum of stakes
 * @param totalReturn sum of gross payouts
 * @param realizedRoi (return - stake) / stake; {@code null} when nothing was staked
 */
public record Reconciliation(
    @JsonProperty("outcomes")    List<TicketOutcome> outcomes,
    @JsonProperty("totalStake")  BigDecimal totalStake,
    @JsonProperty("totalReturn") BigDecimal totalReturn,
    @JsonProperty("realizedRoi") Double realizedRoi
) {
    public Reconciliation {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }
}
