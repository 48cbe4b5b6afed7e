package com.collectible.market.collectible_market.event;

import com.collectible.market.collectible_market.entity.Money;

import lombok.Value;

@Value
public class NewBid implements MarketEvent {
    long auctionId;
    String bidder;
    Money amount;
    long endTime;
}
