package com.raceplatform.common.exception;

/**
 * Staking arithmetic cannot proceed (negative budget, zero increment, ...). Treated as a
 * configuration error, never as a per-race abstention.
 */
public class AllocationFailureException extends PipelineException {

    public AllocationFailureException(String message) {
        super("StakingAllocator", message);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
