package com.raceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Everything the tracking sink receives for one phase invocation: the decision plus the
 * estimate and verdict trail that produced it.
 *
 * @param decision        the emitted decision
 * @param estimates       best SP / COMBO estimates considered (empty outside H5)
 * @param verdicts        one verdict per guardrail stage that ran, in order
 * @param overroundCeiling ceiling applied by the market stage; {@code null} when it never ran
 * @param droppedLegs     candidate legs that did not become tickets
 * @param drift           H30 → H5 odds movement, audit only
 */
public record DecisionArtifact(
    @JsonProperty("decision")         Decision decision,
    @JsonProperty("estimates")        List<Estimate> estimates,
    @JsonProperty("verdicts")         List<GuardrailVerdict> verdicts,
    @JsonProperty("overroundCeiling") Double overroundCeiling,
    @JsonProperty("droppedLegs")      List<DroppedLeg> droppedLegs,
    @JsonProperty("drift")            List<RunnerDrift> drift
) {
    public DecisionArtifact {
        estimates   = estimates == null ? List.of() : List.copyOf(estimates);
        verdicts    = verdicts == null ? List.of() : List.copyOf(verdicts);
        droppedLegs = droppedLegs == null ? List.of() : List.copyOf(droppedLegs);
        drift       = drift == null ? List.of() : List.copyOf(drift);
    }

    public static DecisionArtifact bare(Decision decision) {
        return new DecisionArtifact(decision, List.of(), List.of(), null, List.of(), List.of());
    }
}
