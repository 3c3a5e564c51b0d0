package com.raceplatform.common.model;

public enum GuardrailStage {
    MARKET,
    SP,
    COMBO,
    GLOBAL,
    /** Combined verdict returned by the single-call evaluator contract. */
    CASCADE
}
