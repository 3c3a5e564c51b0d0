package com.raceplatform.common.estimate;

import com.raceplatform.common.config.GpiConfig;
import com.raceplatform.common.exception.EstimationFailureException;
import com.raceplatform.common.model.BetKind;
import com.raceplatform.common.model.Estimate;
import com.raceplatform.common.model.RaceSnapshot;
import com.raceplatform.common.model.Runner;

import java.util.List;
import java.util.OptionalDouble;

/**
 * GPI v5.1 EV/ROI estimator.
 *
 * <h3>SP (one runner)</h3>
 * <pre>
 *   p        = calibrated win probability (never 1/odds, which carries the overround)
 *   evRatio  = p · (odds − 1) − (1 − p)
 *   roiRatio = p · (1 + (odds − 1) · (1 − roiPayoutHaircut)) − 1
 * </pre>
 *
 * <h3>COMBO (place basket)</h3>
 * <pre>
 *   p        = Harville probability that all legs finish in the first max(3, legs) places,
 *              from calibrated win probabilities normalised over the active field
 *   payout   = PayoutModel.comboPayoutPerUnit
 *   evRatio  = p · payout − 1
 *   roiRatio = p · (1 + (payout − 1) · (1 − roiPayoutHaircut)) − 1
 * </pre>
 *
 * <p>The Harville model needs the whole field, so a COMBO estimate fails closed when any active
 * runner lacks a calibrated probability, including runners outside the basket. Partial
 * calibrations are not renormalised over the calibrated subset.
 *
 * <p>ROI prices the same bet against returns shaded by the expected late-market drift, so it
 * is a separate, stricter metric than EV. {@code expectedPayout} is the gross return for
 * {@code comboReferenceStake}. Nothing is rounded here.
 */
public class EvRoiEstimator implements Estimator {

    @Override
    public Estimate estimate(RaceSnapshot snapshot, List<String> bettableSubset, PayoutModel payoutModel,
                             GpiConfig config) {
        BetKind kind = bettableSubset.size() == 1 ? BetKind.SP : BetKind.COMBO;
        try {
            if (bettableSubset.isEmpty()) {
                throw new EstimationFailureException("empty bettable subset");
            }
            if (payoutModel == null) {
                throw new EstimationFailureException("no payout model");
            }
            return kind == BetKind.SP
                ? estimateSp(snapshot, bettableSubset.get(0), payoutModel, config)
                : estimateCombo(snapshot, bettableSubset, payoutModel, config);
        } catch (EstimationFailureException e) {
            return Estimate.failed(kind, bettableSubset, e.getMessage());
        }
    }

    private Estimate estimateSp(RaceSnapshot snapshot, String runnerId, PayoutModel model, GpiConfig config) {
        Runner runner = activeRunner(snapshot, runnerId);
        if (!runner.hasValidWinOdds()) {
            throw new EstimationFailureException("missing or non-positive odds for runner " + runnerId);
        }
        double p = calibratedProbability(model, runnerId);
        double odds = runner.winOdds();
        double net = odds - 1.0;

        double ev  = p * net - (1.0 - p);
        double roi = p * (1.0 + net * (1.0 - config.roiPayoutHaircut())) - 1.0;
        return Estimate.of(BetKind.SP, ev, roi, odds * config.comboReferenceStake(),
                           List.of(runnerId), p, odds);
    }

    private Estimate estimateCombo(RaceSnapshot snapshot, List<String> legs, PayoutModel model,
                                   GpiConfig config) {
        List<Runner> active = snapshot.activeRunners();
        int[] basket = new int[legs.size()];
        for (int b = 0; b < legs.size(); b++) {
            Runner leg = activeRunner(snapshot, legs.get(b));
            if (!leg.hasValidWinOdds()) {
                throw new EstimationFailureException("missing or non-positive odds for runner " + leg.id());
            }
            basket[b] = active.indexOf(leg);
        }

        double[] weights = new double[active.size()];
        for (int i = 0; i < active.size(); i++) {
            weights[i] = calibratedProbability(model, active.get(i).id());
        }
        double[] field = HarvilleCombinatorics.normalise(weights);
        if (field == null) {
            throw new EstimationFailureException("calibrated field probabilities do not normalise");
        }

        double p = HarvilleCombinatorics.basketProbability(
            field, basket, config.comboSimulationIterations(), config.comboSimulationSeed());
        double payout = model.comboPayoutPerUnit(snapshot, legs);
        if (!Double.isFinite(payout) || payout <= 0.0) {
            throw new EstimationFailureException("payout model returned no payout for basket " + legs);
        }
        if (p <= 0.0) {
            throw new EstimationFailureException("basket " + legs + " has zero probability");
        }

        double ev  = p * payout - 1.0;
        double roi = p * (1.0 + (payout - 1.0) * (1.0 - config.roiPayoutHaircut())) - 1.0;
        return Estimate.of(BetKind.COMBO, ev, roi, payout * config.comboReferenceStake(), legs, p, payout);
    }

    private static Runner activeRunner(RaceSnapshot snapshot, String runnerId) {
        Runner runner = snapshot.runner(runnerId)
            .orElseThrow(() -> new EstimationFailureException("unknown runner " + runnerId));
        if (runner.scratched()) {
            throw new EstimationFailureException("runner " + runnerId + " is scratched");
        }
        return runner;
    }

    private static double calibratedProbability(PayoutModel model, String runnerId) {
        OptionalDouble p = model.winProbability(runnerId);
        if (p.isEmpty() || !(p.getAsDouble() > 0.0) || !(p.getAsDouble() < 1.0)) {
            throw new EstimationFailureException("missing or invalid calibrated probability for runner " + runnerId);
        }
        return p.getAsDouble();
    }
}
