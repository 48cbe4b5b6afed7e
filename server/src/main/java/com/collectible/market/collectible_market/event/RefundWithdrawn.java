package com.collectible.market.collectible_market.event;

import com.collectible.market.collectible_market.entity.Money;

import lombok.Value;

@Value
public class RefundWithdrawn implements MarketEvent {
    long auctionId;
    String bidder;
    String currency;
    Money amount;
}
