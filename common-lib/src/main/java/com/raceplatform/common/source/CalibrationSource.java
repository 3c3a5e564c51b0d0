package com.raceplatform.common.source;

import com.raceplatform.common.estimate.PayoutModel;
import reactor.core.publisher.Mono;

/**
 * Calibrated probability and payout model for one race.
 */
public interface CalibrationSource {

    Mono<PayoutModel> fetch(String meetingId, String raceId);
}
