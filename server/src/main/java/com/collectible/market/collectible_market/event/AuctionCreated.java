package com.collectible.market.collectible_market.event;

import com.collectible.market.collectible_market.entity.Money;

import lombok.Value;

@Value
public class AuctionCreated implements MarketEvent {
    long auctionId;
    String seller;
    long assetId;
    String currency;
    Money minBid;
    Money buyoutBid;
    long timeBuffer;
    int bidBufferBps;
    long startTime;
    long endTime;
}
