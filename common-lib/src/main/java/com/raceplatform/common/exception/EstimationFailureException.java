package com.raceplatform.common.exception;

/**
 * Probability/odds inconsistency for one candidate. Confined to that candidate: the
 * estimator converts it into a fail-closed sentinel estimate.
 */
public class EstimationFailureException extends PipelineException {

    public EstimationFailureException(String message) {
        super("EvRoiEstimator", message);
    }
}
