package com.raceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * H30 → H5 odds movement of one runner.
 *
 * @param changeRatio (oddsH5 - oddsH30) / oddsH30
 */
public record RunnerDrift(
    @JsonProperty("runnerId")    String runnerId,
    @JsonProperty("oddsH30")     double oddsH30,
    @JsonProperty("oddsH5")      double oddsH5,
    @JsonProperty("changeRatio") double changeRatio,
    @JsonProperty("status")      DriftStatus status
) {}
