package com.collectible.market.collectible_market.engine;

import java.math.BigInteger;

/**
 * Randomness for card draws. Swap the bean for a verifiable-randomness
 * source without touching the draw.
 */
public interface SeedSource {

    BigInteger nextSeed(String caller);

    /**
     * Replace any secret mixed into the seed. Sources without a secret ignore this.
     */
    void rotateSalt();
}
