package com.raceplatform.common.model;

/**
 * Machine-readable abstention and rejection codes carried by verdicts and decisions.
 */
public enum ReasonCode {
    STALE_INPUT,
    INVALID_MARKET,
    OVERROUND_ABOVE_CEILING,
    ESTIMATION_FAILURE,
    EV_BELOW_MIN_SP,
    ROI_BELOW_MIN_SP,
    SP_PROBABILITY_ABOVE_MAX,
    EV_BELOW_MIN_COMBO,
    ROI_BELOW_MIN_COMBO,
    PAYOUT_BELOW_MIN_COMBO,
    PLACE_OVERROUND_ABOVE_CEILING,
    EV_BELOW_MIN_GLOBAL,
    NO_QUALIFYING_CANDIDATE,
    STAKE_BELOW_INCREMENT,
    EXPOSURE_CAP,
    TICKET_CAP,
    DATA_UNAVAILABLE,
    ENRICHMENT_MISSING,
    NO_FRESH_DATA_SINCE_H30,
    RESULTS_UNAVAILABLE,
    PHASE_NEVER_BETS
}
