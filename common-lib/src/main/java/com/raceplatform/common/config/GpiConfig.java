package com.raceplatform.common.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.raceplatform.common.exception.ConfigInvalidException;
import com.raceplatform.common.model.ExoticType;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * GPI v5.1 thresholds, passed explicitly into every pipeline invocation.
 *
 * <p>Immutable. There are no defaults here: every field must be supplied by the deployment
 * (see {@code gpi.*} in the orchestrator's {@code application.yml}) and {@link #validate()}
 * rejects anything malformed.
 *
 * <h3>Guardrails</h3>
 * <pre>
 *   freshnessMaxAgeSeconds      max age of odds / runners / scratches / calibration
 *   overroundCeiling            Σ 1/odds ceiling
 *   overroundCeilingHandicap    stricter ceiling for handicaps with ≥ handicapMinStarters
 *   evMinSp, roiMinSp           SP leg thresholds
 *   spMaxProbability            reject over-short favourites
 *   evMinCombo, roiMinCombo     COMBO leg thresholds
 *   minPayout                   COMBO expected payout floor (currency)
 *   overroundCeilingExotics     place-market overround above which no COMBO is proposed
 *   evMinGlobal                 aggregate EV floor when a COMBO is proposed
 * </pre>
 *
 * <h3>Staking</h3>
 * <pre>
 *   budget, kellyFraction, exposureCapFraction, minStakeIncrement, maxTicketsPerRace
 * </pre>
 */
public record GpiConfig(
    @JsonProperty("budget")                    double budget,
    @JsonProperty("kellyFraction")             double kellyFraction,
    @JsonProperty("exposureCapFraction")       double exposureCapFraction,
    @JsonProperty("overroundCeiling")          double overroundCeiling,
    @JsonProperty("overroundCeilingHandicap")  double overroundCeilingHandicap,
    @JsonProperty("handicapMinStarters")       int handicapMinStarters,
    @JsonProperty("evMinSp")                   double evMinSp,
    @JsonProperty("roiMinSp")                  double roiMinSp,
    @JsonProperty("spMaxProbability")          double spMaxProbability,
    @JsonProperty("evMinCombo")                double evMinCombo,
    @JsonProperty("roiMinCombo")               double roiMinCombo,
    @JsonProperty("minPayout")                 double minPayout,
    @JsonProperty("evMinGlobal")               double evMinGlobal,
    @JsonProperty("minStakeIncrement")         double minStakeIncrement,
    @JsonProperty("maxTicketsPerRace")         int maxTicketsPerRace,
    @JsonProperty("freshnessMaxAgeSeconds")    long freshnessMaxAgeSeconds,
    @JsonProperty("allowedExotics")            List<ExoticType> allowedExotics,
    @JsonProperty("overroundCeilingExotics")   double overroundCeilingExotics,
    @JsonProperty("comboPoolSize")             int comboPoolSize,
    @JsonProperty("comboReferenceStake")       double comboReferenceStake,
    @JsonProperty("comboSimulationIterations") int comboSimulationIterations,
    @JsonProperty("comboSimulationSeed")       long comboSimulationSeed,
    @JsonProperty("roiPayoutHaircut")          double roiPayoutHaircut,
    @JsonProperty("driftThreshold")            double driftThreshold
) {

    public GpiConfig {
        allowedExotics = allowedExotics == null
            ? List.of()
            : allowedExotics.stream().filter(Objects::nonNull).distinct().sorted().toList();
    }

    /** Leg count of the largest allowed exotic; 0 when exotics are disabled. */
    public int maxExoticLegs() {
        return allowedExotics.stream().mapToInt(ExoticType::legs).max().orElse(0);
    }

    public Duration freshnessMaxAge() {
        return Duration.ofSeconds(freshnessMaxAgeSeconds);
    }

    /** Currency cap on any single runner across all tickets. */
    public double exposureCapAmount() {
        return exposureCapFraction * budget;
    }

    /**
     * Checks every field and throws once with the full list of violations.
     *
     * @return this config, for chaining
     * @throws ConfigInvalidException when any field is out of range
     */
    public GpiConfig validate() {
        List<String> violations = new ArrayList<>();
        positive(violations, "budget", budget);
        fraction(violations, "kellyFraction", kellyFraction);
        fraction(violations, "exposureCapFraction", exposureCapFraction);
        if (!(overroundCeiling >= 1.0)) {
            violations.add("overroundCeiling must be >= 1.0, got " + overroundCeiling);
        }
        if (!(overroundCeilingHandicap >= 1.0) || overroundCeilingHandicap > overroundCeiling) {
            violations.add("overroundCeilingHandicap must be in [1.0, overroundCeiling], got "
                + overroundCeilingHandicap);
        }
        if (handicapMinStarters < 2) {
            violations.add("handicapMinStarters must be >= 2, got " + handicapMinStarters);
        }
        finite(violations, "evMinSp", evMinSp);
        finite(violations, "roiMinSp", roiMinSp);
        fraction(violations, "spMaxProbability", spMaxProbability);
        finite(violations, "evMinCombo", evMinCombo);
        finite(violations, "roiMinCombo", roiMinCombo);
        if (!(minPayout >= 0.0)) {
            violations.add("minPayout must be >= 0, got " + minPayout);
        }
        finite(violations, "evMinGlobal", evMinGlobal);
        positive(violations, "minStakeIncrement", minStakeIncrement);
        if (minStakeIncrement > budget) {
            violations.add("minStakeIncrement must not exceed budget");
        }
        if (maxTicketsPerRace < 1 || maxTicketsPerRace > 2) {
            violations.add("maxTicketsPerRace must be 1 or 2, got " + maxTicketsPerRace);
        }
        if (freshnessMaxAgeSeconds <= 0) {
            violations.add("freshnessMaxAgeSeconds must be > 0, got " + freshnessMaxAgeSeconds);
        }
        if (comboPoolSize < maxExoticLegs()) {
            violations.add("comboPoolSize must be >= the largest allowed exotic (" + maxExoticLegs()
                + " legs), got " + comboPoolSize);
        }
        if (!(overroundCeilingExotics >= 1.0)) {
            violations.add("overroundCeilingExotics must be >= 1.0, got " + overroundCeilingExotics);
        }
        positive(violations, "comboReferenceStake", comboReferenceStake);
        if (comboSimulationIterations <= 0) {
            violations.add("comboSimulationIterations must be > 0, got " + comboSimulationIterations);
        }
        if (!(roiPayoutHaircut >= 0.0 && roiPayoutHaircut < 1.0)) {
            violations.add("roiPayoutHaircut must be in [0, 1), got " + roiPayoutHaircut);
        }
        if (!(driftThreshold > 0.0 && driftThreshold < 1.0)) {
            violations.add("driftThreshold must be in (0, 1), got " + driftThreshold);
        }
        if (!violations.isEmpty()) {
            throw new ConfigInvalidException(violations);
        }
        return this;
    }

    private static void positive(List<String> violations, String field, double value) {
        if (!(Double.isFinite(value) && value > 0.0)) {
            violations.add(field + " must be > 0, got " + value);
        }
    }

    private static void fraction(List<String> violations, String field, double value) {
        if (!(value > 0.0 && value <= 1.0)) {
            violations.add(field + " must be in (0, 1], got " + value);
        }
    }

    private static void finite(List<String> violations, String field, double value) {
        if (!Double.isFinite(value)) {
            violations.add(field + " must be a finite number, got " + value);
        }
    }
}
