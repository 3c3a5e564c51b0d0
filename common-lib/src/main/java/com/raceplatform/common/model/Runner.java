package com.raceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One starter as published by the odds provider.
 *
 * @param id        stable identifier, unique within a snapshot
 * @param number    saddle-cloth number
 * @param name      horse name (display only)
 * @param winOdds   decimal win odds; {@code null} when the market has no price yet
 * @param placeOdds decimal place odds; optional
 * @param scratched true when the runner is a non-starter
 */
public record Runner(
    @JsonProperty("id")        String id,
    @JsonProperty("number")    int number,
    @JsonProperty("name")      String name,
    @JsonProperty("winOdds")   Double winOdds,
    @JsonProperty("placeOdds") Double placeOdds,
    @JsonProperty("scratched") boolean scratched
) {
    public Runner {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("runner id is required");
        }
    }

    /** True when the runner carries a usable decimal win price. */
    public boolean hasValidWinOdds() {
        return winOdds != null && Double.isFinite(winOdds) && winOdds > 1.0;
    }
}
