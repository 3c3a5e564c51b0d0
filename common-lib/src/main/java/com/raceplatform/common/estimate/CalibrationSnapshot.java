package com.raceplatform.common.estimate;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Output of the external probability estimator for one race.
 *
 * @param calibratedAt       production instant of the curve
 * @param winProbabilities   calibrated win probability per runner id
 * @param takeoutRate        parimutuel pool deduction for basket bets (e.g. 0.25)
 * @param payoutCalibration  multiplicative correction from historical payout drift (1.0 = none)
 */
public record CalibrationSnapshot(
    @JsonProperty("calibratedAt")      Instant calibratedAt,
    @JsonProperty("winProbabilities")  Map<String, Double> winProbabilities,
    @JsonProperty("takeoutRate")       double takeoutRate,
    @JsonProperty("payoutCalibration") double payoutCalibration
) {
    public CalibrationSnapshot {
        winProbabilities = winProbabilities == null ? Map.of() : Map.copyOf(winProbabilities);
    }
}
