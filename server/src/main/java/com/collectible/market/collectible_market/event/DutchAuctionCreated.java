package com.collectible.market.collectible_market.event;

import com.collectible.market.collectible_market.entity.Money;

import lombok.Value;

@Value
public class DutchAuctionCreated implements MarketEvent {
    long auctionId;
    String seller;
    long assetId;
    String currency;
    Money startPrice;
    Money endPrice;
    long startTime;
    long duration;
    int decayExponent;
}
