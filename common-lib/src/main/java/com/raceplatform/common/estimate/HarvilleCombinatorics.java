package com.raceplatform.common.estimate;

import java.util.Arrays;
import java.util.SplittableRandom;

/**
 * Place-basket probabilities under the Harville model.
 *
 * <p>Given win probabilities {@code p_i} over the active field (summing to 1), the
 * probability of a finishing order {@code (a, b, c, ...)} is
 * <pre>
 *   p_a · p_b / (1 − p_a) · p_c / (1 − p_a − p_b) · ...
 * </pre>
 * A basket of {@code m} runners "lands" when every member finishes within the first
 * {@code depth = max(3, m)} places.
 *
 * <h3>Method</h3>
 * <ul>
 *   <li>m ≤ 3: exact. All ordered top-{@code depth} prefixes are enumerated (n·(n−1)·(n−2)
 *       terms for depth 3) and the probabilities of prefixes containing the whole basket
 *       are summed.</li>
 *   <li>m &gt; 3: Monte Carlo. Finishing orders are drawn sequentially without replacement
 *       from a {@link SplittableRandom} seeded by the caller, so a fixed seed always gives
 *       the same estimate.</li>
 * </ul>
 *
 * <p>Stateless.
 */
public final class HarvilleCombinatorics {

    /** Baskets up to this size are enumerated exactly. */
    public static final int MAX_EXACT_LEGS = 3;

    /** Minimum number of paid places for a basket. */
    public static final int MIN_DEPTH = 3;

    private HarvilleCombinatorics() {}

    public static int depthFor(int legs) {
        return Math.max(MIN_DEPTH, legs);
    }

    /**
     * Dispatches to the exact or simulated method according to the basket size.
     *
     * @param field      normalised win probabilities of the active field
     * @param basket     indices into {@code field}
     * @param iterations Monte Carlo draws (ignored for exact baskets)
     * @param seed       Monte Carlo seed (ignored for exact baskets)
     */
    public static double basketProbability(double[] field, int[] basket, int iterations, long seed) {
        if (basket.length <= MAX_EXACT_LEGS) {
            return exactBasketProbability(field, basket);
        }
        return simulatedBasketProbability(field, basket, iterations, seed);
    }

    static double exactBasketProbability(double[] field, int[] basket) {
        int depth = Math.min(depthFor(basket.length), field.length);
        if (basket.length > depth) {
            return 0.0;
        }
        boolean[] used = new boolean[field.length];
        return enumerate(field, basket, depth, used, 0, 1.0, 1.0);
    }

    private static double enumerate(double[] field, int[] basket, int depth, boolean[] used,
                                     int placed, double remainingMass, double prefixProbability) {
        if (placed == depth) {
            return containsAll(used, basket) ? prefixProbability : 0.0;
        }
        if (remainingMass <= 0.0) {
            return 0.0;
        }
        double total = 0.0;
        for (int i = 0; i < field.length; i++) {
            if (used[i] || field[i] <= 0.0) {
                continue;
            }
            used[i] = true;
            total += enumerate(field, basket, depth, used, placed + 1,
                               remainingMass - field[i],
                               prefixProbability * field[i] / remainingMass);
            used[i] = false;
        }
        return total;
    }

    static double simulatedBasketProbability(double[] field, int[] basket, int iterations, long seed) {
        int depth = Math.min(depthFor(basket.length), field.length);
        if (basket.length > depth || iterations <= 0) {
            return 0.0;
        }
        SplittableRandom random = new SplittableRandom(seed);
        boolean[] used = new boolean[field.length];
        int hits = 0;
        for (int it = 0; it < iterations; it++) {
            Arrays.fill(used, false);
            double remaining = 1.0;
            for (int place = 0; place < depth; place++) {
                int pick = draw(field, used, remaining, random);
                if (pick < 0) {
                    break;
                }
                used[pick] = true;
                remaining -= field[pick];
            }
            if (containsAll(used, basket)) {
                hits++;
            }
        }
        return (double) hits / iterations;
    }

    private static int draw(double[] field, boolean[] used, double remaining, SplittableRandom random) {
        double target = random.nextDouble() * remaining;
        int last = -1;
        double cumulative = 0.0;
        for (int i = 0; i < field.length; i++) {
            if (used[i] || field[i] <= 0.0) {
                continue;
            }
            last = i;
            cumulative += field[i];
            if (target < cumulative) {
                return i;
            }
        }
        return last;
    }

    private static boolean containsAll(boolean[] used, int[] basket) {
        for (int idx : basket) {
            if (!used[idx]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Scales non-negative weights so they sum to 1. Returns {@code null} when the total is
     * not positive; callers treat that as an estimation failure.
     */
    public static double[] normalise(double[] weights) {
        double total = 0.0;
        for (double w : weights) {
            if (!(w >= 0.0) || !Double.isFinite(w)) {
                return null;
            }
            total += w;
        }
        if (total <= 0.0) {
            return null;
        }
        double[] out = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            out[i] = weights[i] / total;
        }
        return out;
    }
}
