package com.raceplatform.common.estimate;

import com.raceplatform.common.config.GpiConfig;
import com.raceplatform.common.model.Estimate;
import com.raceplatform.common.model.RaceSnapshot;

import java.util.List;

/**
 * Computes the EV/ROI projection of one candidate bet.
 *
 * <p>A subset of one runner is an SP candidate; two or more runners form a COMBO basket.
 * Implementations must fail closed: inconsistent inputs yield {@link Estimate#failed} rather
 * than a default-filled estimate.
 */
public interface Estimator {

    Estimate estimate(RaceSnapshot snapshot, List<String> bettableSubset, PayoutModel payoutModel,
                      GpiConfig config);
}
