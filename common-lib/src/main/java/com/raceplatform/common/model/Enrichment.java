package com.raceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Jockey/trainer statistics and chrono data fetched before H5. The decision pipeline refuses
 * to estimate anything when this is absent or incomplete.
 *
 * @param jockeyWinRate  jockey win rate (%) keyed by runner id
 * @param trainerWinRate trainer win rate (%) keyed by runner id
 * @param bestChrono     best recent reduction (seconds) keyed by runner id
 * @param fetchedAt      fetch instant
 */
public record Enrichment(
    @JsonProperty("jockeyWinRate")  Map<String, Double> jockeyWinRate,
    @JsonProperty("trainerWinRate") Map<String, Double> trainerWinRate,
    @JsonProperty("bestChrono")     Map<String, Double> bestChrono,
    @JsonProperty("fetchedAt")      Instant fetchedAt
) {
    public Enrichment {
        jockeyWinRate  = jockeyWinRate == null ? Map.of() : Map.copyOf(jockeyWinRate);
        trainerWinRate = trainerWinRate == null ? Map.of() : Map.copyOf(trainerWinRate);
        bestChrono     = bestChrono == null ? Map.of() : Map.copyOf(bestChrono);
    }

    /** Both the jockey/trainer stats and the chrono block are present. */
    @JsonIgnore
    public boolean isComplete() {
        return (!jockeyWinRate.isEmpty() || !trainerWinRate.isEmpty()) && !bestChrono.isEmpty();
    }
}
