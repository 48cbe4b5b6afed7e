package com.collectible.market.collectible_market.event;

import com.collectible.market.collectible_market.entity.Money;

import lombok.Value;

/**
 * An outbid refund that could not be pushed and waits for withdrawal.
 */
@Value
public class RefundQueued implements MarketEvent {
    long auctionId;
    String bidder;
    String currency;
    Money amount;
}
