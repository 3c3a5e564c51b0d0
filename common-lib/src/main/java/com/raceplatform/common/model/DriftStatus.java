package com.raceplatform.common.model;

/**
 * Direction of a runner's odds movement between H30 and H5.
 */
public enum DriftStatus {
    /** Odds shortened beyond the threshold. */
    STEAM,
    /** Odds lengthened beyond the threshold. */
    DRIFT,
    STABLE
}
