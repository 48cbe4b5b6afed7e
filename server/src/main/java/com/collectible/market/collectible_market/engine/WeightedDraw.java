package com.collectible.market.collectible_market.engine;

import java.math.BigInteger;
import java.util.List;

/**
 * Picks one outcome from basis-point weights using a cumulative-sum walk.
 *
 * r = seed mod 10000; the selected index is the first whose cumulative weight
 * exceeds r. Earlier indexes win ties. The result depends only on the seed and
 * the weights.
 */
public class WeightedDraw {

    public static final int TOTAL_WEIGHT = 10_000;

    private static final BigInteger MODULUS = BigInteger.valueOf(TOTAL_WEIGHT);

    public int select(List<Integer> probabilities, BigInteger seed) {
        int r = seed.mod(MODULUS).intValue();
        int cumulative = 0;
        for (int i = 0; i < probabilities.size(); i++) {
            cumulative += probabilities.get(i);
            if (r < cumulative) {
                return i;
            }
        }
        throw new IllegalArgumentException(
                "Weights sum to " + cumulative + ", expected " + TOTAL_WEIGHT);
    }
}
