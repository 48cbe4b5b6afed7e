package com.collectible.market.collectible_market.event;

import com.collectible.market.collectible_market.entity.Money;

import lombok.Value;

@Value
public class AuctionPayoutCollected implements MarketEvent {
    long auctionId;
    String seller;
    String currency;
    Money proceeds;
    Money marketplaceFee;
}
