package com.raceplatform.common.estimate;

import com.raceplatform.common.model.RaceSnapshot;
import com.raceplatform.common.model.Runner;

import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Default {@link PayoutModel}: calibrated win probabilities from a {@link CalibrationSnapshot}
 * and pool payouts derived from the public market.
 *
 * <pre>
 *   q_i            = (1 / odds_i) / Σ (1 / odds_j)          de-vigged market probability
 *   P_market(S)    = Harville place-basket probability of S under q
 *   payoutPerUnit  = (1 − takeout) / P_market(S) × payoutCalibration
 * </pre>
 *
 * <p>The edge of a basket comes from the gap between the calibrated probability (used by
 * the estimator) and the market probability that sets the pool dividend.
 */
public class ParimutuelPayoutModel implements PayoutModel {

    private final CalibrationSnapshot calibration;
    private final int simulationIterations;
    private final long simulationSeed;

    public ParimutuelPayoutModel(CalibrationSnapshot calibration, int simulationIterations, long simulationSeed) {
        this.calibration          = calibration;
        this.simulationIterations = simulationIterations;
        this.simulationSeed       = simulationSeed;
    }

    @Override
    public Instant calibratedAt() {
        return calibration.calibratedAt();
    }

    @Override
    public OptionalDouble winProbability(String runnerId) {
        Double p = calibration.winProbabilities().get(runnerId);
        return p == null ? OptionalDouble.empty() : OptionalDouble.of(p);
    }

    @Override
    public double comboPayoutPerUnit(RaceSnapshot snapshot, List<String> legs) {
        List<Runner> active = snapshot.activeRunners();
        double[] implied = new double[active.size()];
        for (int i = 0; i < active.size(); i++) {
            Runner r = active.get(i);
            if (!r.hasValidWinOdds()) {
                return 0.0;
            }
            implied[i] = 1.0 / r.winOdds();
        }
        double[] market = HarvilleCombinatorics.normalise(implied);
        if (market == null) {
            return 0.0;
        }
        int[] basket = new int[legs.size()];
        for (int b = 0; b < legs.size(); b++) {
            int idx = indexOf(active, legs.get(b));
            if (idx < 0) {
                return 0.0;
            }
            basket[b] = idx;
        }
        double marketProbability = HarvilleCombinatorics.basketProbability(
            market, basket, simulationIterations, simulationSeed);
        if (marketProbability <= 0.0) {
            return 0.0;
        }
        return (1.0 - calibration.takeoutRate()) / marketProbability * calibration.payoutCalibration();
    }

    private static int indexOf(List<Runner> active, String runnerId) {
        for (int i = 0; i < active.size(); i++) {
            if (active.get(i).id().equals(runnerId)) {
                return i;
            }
        }
        return -1;
    }
}
