package com.collectible.market.collectible_market.support;

import java.math.BigInteger;

import com.collectible.market.collectible_market.engine.SeedSource;

public class FixedSeedSource implements SeedSource {

    private volatile BigInteger seed = BigInteger.ZERO;
    private int rotations;

    public void setSeed(long seed) {
        this.seed = BigInteger.valueOf(seed);
    }

    public int getRotations() {
        return rotations;
    }

    @Override
    public BigInteger nextSeed(String caller) {
        return seed;
    }

    @Override
    public void rotateSalt() {
        rotations++;
    }
}
