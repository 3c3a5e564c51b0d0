package com.raceplatform.common.model;

/**
 * Inputs whose age is checked by the freshness guardrail.
 */
public enum MandatoryInput {
    ODDS("odds"),
    RUNNERS("runners"),
    SCRATCHES("scratches"),
    CALIBRATION("calibration");

    private final String label;

    MandatoryInput(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
