package com.raceplatform.common.estimate;

import com.raceplatform.common.model.RaceSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Calibrated probability and payout source consumed by the estimator.
 *
 * <p>Implementations are supplied by the calibration collaborator. The estimator never
 * substitutes a default when a method returns empty or a non-positive value; it fails closed.
 */
public interface PayoutModel {

    /** Instant the calibration curve was produced; checked by the freshness guardrail. */
    Instant calibratedAt();

    /** Calibrated probability that the runner wins; empty when unknown. */
    OptionalDouble winProbability(String runnerId);

    /**
     * Expected gross payout per unit staked on a place basket, when it lands.
     *
     * @param snapshot current snapshot (market prices drive parimutuel pools)
     * @param legs     basket runner ids
     * @return payout per unit, or a non-positive value when it cannot be modelled
     */
    double comboPayoutPerUnit(RaceSnapshot snapshot, List<String> legs);
}
