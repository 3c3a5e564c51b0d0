package com.raceplatform.common.guard;

import com.raceplatform.common.config.GpiConfig;
import com.raceplatform.common.model.BetKind;
import com.raceplatform.common.model.Estimate;
import com.raceplatform.common.model.GuardrailStage;
import com.raceplatform.common.model.GuardrailVerdict;
import com.raceplatform.common.model.MandatoryInput;
import com.raceplatform.common.model.RaceSnapshot;
import com.raceplatform.common.model.ReasonCode;
import com.raceplatform.common.model.RejectionReason;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * GPI v5.1 guardrail cascade.
 *
 * <h3>Stages (fixed order)</h3>
 * <ol>
 *   <li>{@link GuardrailStage#MARKET}: freshness of odds / runners / scratches / calibration,
 *       then the overround gate ({@link OverroundPolicy}).</li>
 *   <li>{@link GuardrailStage#SP}: evRatio ≥ evMinSp, roiRatio ≥ roiMinSp,
 *       probability ≤ spMaxProbability.</li>
 *   <li>{@link GuardrailStage#COMBO}: place-market overround ≤ overroundCeilingExotics
 *       ({@link #evaluateExoticMarket}), then per basket evRatio ≥ evMinCombo,
 *       roiRatio ≥ roiMinCombo, expectedPayout ≥ minPayout.</li>
 *   <li>{@link GuardrailStage#GLOBAL}: skipped without a COMBO; otherwise the mean evRatio of the
 *       proposed legs must reach evMinGlobal.</li>
 * </ol>
 *
 * <p>EV and ROI are distinct required metrics. A non-finite value for either fails closed;
 * one is never read in place of the other.
 *
 * <p>Stateless, pure and thread-safe. Every method is a function of its arguments only.
 */
public final class GuardrailEvaluator {

    private GuardrailEvaluator() {}

    /**
     * Single-call contract: market stage first; bet stages only when the market passed.
     *
     * @param snapshot     snapshot under evaluation
     * @param calibratedAt calibration curve timestamp ({@code null} = missing)
     * @param estimates    proposed legs (at most one per kind is expected)
     * @param config       thresholds
     * @param asOf         evaluation instant used for freshness
     * @return a {@link GuardrailStage#CASCADE} verdict with all distinct reasons
     */
    public static GuardrailVerdict evaluate(RaceSnapshot snapshot, Instant calibratedAt,
                                            List<Estimate> estimates, GpiConfig config, Instant asOf) {
        GuardrailVerdict market = evaluateMarket(snapshot, calibratedAt, config, asOf);
        if (!market.passed()) {
            return GuardrailVerdict.combine(GuardrailStage.CASCADE, List.of(market));
        }
        List<GuardrailVerdict> stages = new ArrayList<>();
        if (estimates.stream().anyMatch(e -> e.kind() == BetKind.COMBO)) {
            stages.add(evaluateExoticMarket(snapshot, config));
        }
        for (Estimate estimate : estimates) {
            stages.add(estimate.kind() == BetKind.SP
                ? evaluateSp(estimate, config)
                : evaluateCombo(estimate, config));
        }
        stages.add(evaluateGlobal(estimates, config));
        return GuardrailVerdict.combine(GuardrailStage.CASCADE, stages);
    }

    /**
     * Freshness then overround. Freshness failures short-circuit the overround gate so that
     * stale odds are never used to compute a margin.
     */
    public static GuardrailVerdict evaluateMarket(RaceSnapshot snapshot, Instant calibratedAt,
                                                  GpiConfig config, Instant asOf) {
        List<RejectionReason> reasons = new ArrayList<>();
        Duration maxAge = config.freshnessMaxAge();
        for (MandatoryInput input : MandatoryInput.values()) {
            Instant captured = input == MandatoryInput.CALIBRATION ? calibratedAt : snapshot.capturedAt(input);
            if (captured == null || Duration.between(captured, asOf).compareTo(maxAge) > 0) {
                reasons.add(RejectionReason.of(ReasonCode.STALE_INPUT, "stale input: " + input.label()));
            }
        }
        if (!reasons.isEmpty()) {
            return GuardrailVerdict.of(GuardrailStage.MARKET, reasons);
        }

        OptionalDouble overround = snapshot.overround();
        if (overround.isEmpty()) {
            reasons.add(RejectionReason.of(ReasonCode.INVALID_MARKET,
                "overround not computable: empty field or missing/non-positive odds"));
            return GuardrailVerdict.of(GuardrailStage.MARKET, reasons);
        }
        double ceiling = OverroundPolicy.ceilingFor(snapshot, config);
        if (overround.getAsDouble() > ceiling) {
            reasons.add(RejectionReason.of(ReasonCode.OVERROUND_ABOVE_CEILING,
                String.format(Locale.ROOT, "overround %.4f above ceiling %.2f%s", overround.getAsDouble(), ceiling,
                    OverroundPolicy.isLargeHandicap(snapshot, config) ? " (handicap field)" : "")));
        }
        return GuardrailVerdict.of(GuardrailStage.MARKET, reasons);
    }

    /**
     * Place-pool margin gate for exotics. Uses place odds, falling back to win odds per runner;
     * a pool whose overround cannot be computed is rejected.
     */
    public static GuardrailVerdict evaluateExoticMarket(RaceSnapshot snapshot, GpiConfig config) {
        OptionalDouble placeOverround = snapshot.placeOverround();
        if (placeOverround.isEmpty()) {
            return GuardrailVerdict.of(GuardrailStage.COMBO, List.of(RejectionReason.of(ReasonCode.INVALID_MARKET,
                "place overround not computable: empty field or missing odds")));
        }
        if (placeOverround.getAsDouble() > config.overroundCeilingExotics()) {
            return GuardrailVerdict.of(GuardrailStage.COMBO, List.of(RejectionReason.of(
                ReasonCode.PLACE_OVERROUND_ABOVE_CEILING,
                String.format(Locale.ROOT, "place overround %.4f above exotics ceiling %.2f",
                    placeOverround.getAsDouble(), config.overroundCeilingExotics()))));
        }
        return GuardrailVerdict.pass(GuardrailStage.COMBO);
    }

    public static GuardrailVerdict evaluateSp(Estimate sp, GpiConfig config) {
        List<RejectionReason> reasons = new ArrayList<>();
        if (!sp.isUsable()) {
            reasons.add(estimationFailure(sp));
            return GuardrailVerdict.of(GuardrailStage.SP, reasons);
        }
        if (sp.evRatio() < config.evMinSp()) {
            reasons.add(RejectionReason.of(ReasonCode.EV_BELOW_MIN_SP,
                String.format(Locale.ROOT, "SP ev %.4f below minimum %.2f", sp.evRatio(), config.evMinSp())));
        }
        if (sp.roiRatio() < config.roiMinSp()) {
            reasons.add(RejectionReason.of(ReasonCode.ROI_BELOW_MIN_SP,
                String.format(Locale.ROOT, "SP roi %.4f below minimum %.2f", sp.roiRatio(), config.roiMinSp())));
        }
        if (sp.probability() > config.spMaxProbability()) {
            reasons.add(RejectionReason.of(ReasonCode.SP_PROBABILITY_ABOVE_MAX,
                String.format(Locale.ROOT, "SP probability %.4f above maximum %.2f", sp.probability(),
                    config.spMaxProbability())));
        }
        return GuardrailVerdict.of(GuardrailStage.SP, reasons);
    }

    public static GuardrailVerdict evaluateCombo(Estimate combo, GpiConfig config) {
        List<RejectionReason> reasons = new ArrayList<>();
        if (!combo.isUsable()) {
            reasons.add(estimationFailure(combo));
            return GuardrailVerdict.of(GuardrailStage.COMBO, reasons);
        }
        if (combo.evRatio() < config.evMinCombo()) {
            reasons.add(RejectionReason.of(ReasonCode.EV_BELOW_MIN_COMBO,
                String.format(Locale.ROOT, "combo ev %.4f below minimum %.2f", combo.evRatio(), config.evMinCombo())));
        }
        if (combo.roiRatio() < config.roiMinCombo()) {
            reasons.add(RejectionReason.of(ReasonCode.ROI_BELOW_MIN_COMBO,
                String.format(Locale.ROOT, "combo roi %.4f below minimum %.2f", combo.roiRatio(), config.roiMinCombo())));
        }
        if (combo.expectedPayout() < config.minPayout()) {
            reasons.add(RejectionReason.of(ReasonCode.PAYOUT_BELOW_MIN_COMBO,
                String.format(Locale.ROOT, "combo expected payout %.2f below minimum %.2f", combo.expectedPayout(),
                    config.minPayout())));
        }
        return GuardrailVerdict.of(GuardrailStage.COMBO, reasons);
    }

    /**
     * Aggregate EV gate. Passes trivially when no COMBO leg is proposed.
     */
    public static GuardrailVerdict evaluateGlobal(List<Estimate> proposed, GpiConfig config) {
        boolean comboPresent = proposed.stream().anyMatch(e -> e.kind() == BetKind.COMBO);
        if (!comboPresent) {
            return GuardrailVerdict.pass(GuardrailStage.GLOBAL);
        }
        double evGlobal = evGlobal(proposed);
        if (!(evGlobal >= config.evMinGlobal())) {
            return GuardrailVerdict.of(GuardrailStage.GLOBAL, List.of(RejectionReason.of(
                ReasonCode.EV_BELOW_MIN_GLOBAL,
                String.format(Locale.ROOT, "global ev %.4f below minimum %.2f", evGlobal, config.evMinGlobal()))));
        }
        return GuardrailVerdict.pass(GuardrailStage.GLOBAL);
    }

    /**
     * Unit-weighted mean evRatio of the proposed legs. {@code -Infinity} when any leg is a
     * sentinel; {@code NaN} for an empty list.
     */
    public static double evGlobal(List<Estimate> proposed) {
        if (proposed.isEmpty()) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (Estimate e : proposed) {
            if (!e.isUsable()) {
                return Double.NEGATIVE_INFINITY;
            }
            sum += e.evRatio();
        }
        return sum / proposed.size();
    }

    private static RejectionReason estimationFailure(Estimate estimate) {
        String note = estimate.failureNote() != null
            ? estimate.failureNote()
            : "EV or ROI missing";
        return RejectionReason.of(ReasonCode.ESTIMATION_FAILURE,
            estimate.kind() + " estimate unavailable: " + note);
    }
}
