package com.raceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * A committed stake. {@code stake} is already rounded down to the configured increment.
 *
 * @param kind     SP or COMBO
 * @param stake    currency amount, scale of the stake increment
 * @param runners  runner ids, sorted
 * @param estimate the estimate that justified the ticket
 */
@JsonIgnoreProperties(value = "exoticType", allowGetters = true)
public record Ticket(
    @JsonProperty("kind")     BetKind kind,
    @JsonProperty("stake")    BigDecimal stake,
    @JsonProperty("runners")  List<String> runners,
    @JsonProperty("estimate") Estimate estimate
) {
    public Ticket {
        if (stake == null || stake.signum() <= 0) {
            throw new IllegalArgumentException("ticket stake must be positive, got " + stake);
        }
        runners = runners == null ? List.of() : runners.stream().sorted().toList();
    }

    /** Basket type of a COMBO ticket; {@code null} for SP. */
    @JsonProperty("exoticType")
    public ExoticType exoticType() {
        return estimate == null ? null : estimate.exoticType();
    }

    public boolean involves(String runnerId) {
        return runners.contains(runnerId);
    }
}
