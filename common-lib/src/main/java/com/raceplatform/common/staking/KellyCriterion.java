package com.raceplatform.common.staking;

/**
 * Full-Kelly fraction for a binary bet.
 *
 * <pre>
 *   b  = odds − 1                    net odds (decimal odds, or gross payout per unit for a combo)
 *   f* = (p · b − (1 − p)) / b
 * </pre>
 *
 * <p>Returns 0 when there is no positive edge or the inputs are not a valid bet.
 */
public final class KellyCriterion {

    private KellyCriterion() {}

    public static double fraction(double probability, double odds) {
        double b = odds - 1.0;
        if (!(b > 0.0) || !(probability > 0.0) || !(probability < 1.0) || !Double.isFinite(odds)) {
            return 0.0;
        }
        double f = (probability * b - (1.0 - probability)) / b;
        return f > 0.0 ? f : 0.0;
    }
}
