package com.raceplatform.common.model;

/**
 * Ticket families. At most one ticket of each kind per race and phase.
 */
public enum BetKind {
    /** Single pick on one runner. */
    SP,
    /** Place basket on several runners. */
    COMBO
}
