package com.collectible.market.collectible_market.event;

import com.collectible.market.collectible_market.entity.Money;

import lombok.Value;

/**
 * Published when the winner receives the asset, either by buyout or by collection.
 */
@Value
public class AuctionCompleted implements MarketEvent {
    long auctionId;
    String seller;
    String winner;
    long assetId;
    Money winningBid;
}
