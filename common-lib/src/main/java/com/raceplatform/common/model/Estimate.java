package com.raceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * EV/ROI projection for one candidate bet, recomputed from the current snapshot at every phase.
 *
 * <p>All ratios are fractions of stake (0.42 = +42%). Nothing here is rounded.
 *
 * @param kind            SP or COMBO
 * @param evRatio         expected net return per unit staked
 * @param roiRatio        projected net return per unit staked against drift-shaded odds
 * @param expectedPayout  gross return (currency) for the reference stake when the bet lands
 * @param involvedRunners runner ids, sorted
 * @param probability     calibrated probability that the bet lands
 * @param odds            decimal odds (SP) or gross payout per unit staked (COMBO)
 * @param failureNote     set only on fail-closed sentinels
 * @param exoticType      basket type of a COMBO, derived from the leg count when not given;
 *                        {@code null} for SP
 */
public record Estimate(
    @JsonProperty("kind")            BetKind kind,
    @JsonProperty("evRatio")         double evRatio,
    @JsonProperty("roiRatio")        double roiRatio,
    @JsonProperty("expectedPayout")  double expectedPayout,
    @JsonProperty("involvedRunners") List<String> involvedRunners,
    @JsonProperty("probability")     double probability,
    @JsonProperty("odds")            double odds,
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("failureNote")     String failureNote,
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("exoticType")      ExoticType exoticType
) {
    public Estimate {
        involvedRunners = involvedRunners == null
            ? List.of()
            : involvedRunners.stream().sorted().toList();
        if (kind == BetKind.SP) {
            exoticType = null;
        } else if (exoticType == null) {
            exoticType = ExoticType.forLegs(involvedRunners.size());
        }
    }

    public static Estimate of(BetKind kind, double evRatio, double roiRatio, double expectedPayout,
                              List<String> runners, double probability, double odds) {
        return new Estimate(kind, evRatio, roiRatio, expectedPayout, runners, probability, odds, null, null);
    }

    /**
     * Fail-closed sentinel: EV and ROI are {@code -Infinity} so every threshold rejects it.
     */
    public static Estimate failed(BetKind kind, List<String> runners, String note) {
        return new Estimate(kind, Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY, 0.0,
                            runners, 0.0, 0.0, note, null);
    }

    @JsonIgnore
    public boolean isUsable() {
        return failureNote == null
            && Double.isFinite(evRatio)
            && Double.isFinite(roiRatio)
            && Double.isFinite(probability)
            && Double.isFinite(odds);
    }
}
