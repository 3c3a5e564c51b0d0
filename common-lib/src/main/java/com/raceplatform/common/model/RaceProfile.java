package com.raceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Race-type attributes consulted by race-type predicates (e.g. the stricter overround ceiling).
 *
 * @param discipline free-text discipline ("Plat", "Trot attelé", ...)
 * @param handicap   true for handicap races
 * @param label      race title as published
 */
public record RaceProfile(
    @JsonProperty("discipline") String discipline,
    @JsonProperty("handicap")   boolean handicap,
    @JsonProperty("label")      String label
) {
    public static RaceProfile standard(String discipline) {
        return new RaceProfile(discipline, false, null);
    }
}
