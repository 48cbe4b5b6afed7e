package com.collectible.market.collectible_market.engine;

import java.math.BigInteger;

import com.collectible.market.collectible_market.entity.DutchAuction;
import com.collectible.market.collectible_market.entity.Money;

public class DutchPricingEngine {

    // price = start - floor((start - end) * t^k / duration^k), t clamped to [0, duration]
    public Money currentPrice(DutchAuction auction, long now) {
        return priceAt(auction.getStartPrice(), auction.getEndPrice(), auction.getDuration(),
                auction.getDecayExponent(), now - auction.getStartTime());
    }

    public Money priceAt(Money startPrice, Money endPrice, long duration, int decayExponent, long elapsed) {
        long t = Math.max(0, Math.min(elapsed, duration));
        if (t == 0) {
            return startPrice;
        }
        if (t == duration) {
            return endPrice;
        }
        BigInteger spread = startPrice.toUnits().subtract(endPrice.toUnits());
        BigInteger numerator = spread.multiply(BigInteger.valueOf(t).pow(decayExponent));
        BigInteger denominator = BigInteger.valueOf(duration).pow(decayExponent);
        return Money.ofUnits(startPrice.toUnits().subtract(numerator.divide(denominator)));
    }
}
