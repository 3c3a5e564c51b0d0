package com.raceplatform.common.model;

import com.raceplatform.common.estimate.HarvilleCombinatorics;

/**
 * Place-basket bet types a COMBO leg may take. Each type has its own leg count and every leg
 * must finish within {@link #placeDepth()}.
 */
public enum ExoticType {
    COUPLE_PLACE(2),
    TRIO(3),
    ZE4(4);

    private final int legs;

    ExoticType(int legs) {
        this.legs = legs;
    }

    public int legs() {
        return legs;
    }

    public int placeDepth() {
        return HarvilleCombinatorics.depthFor(legs);
    }

    /** Type with exactly {@code legs} legs, or {@code null}. */
    public static ExoticType forLegs(int legs) {
        for (ExoticType type : values()) {
            if (type.legs == legs) {
                return type;
            }
        }
        return null;
    }
}
