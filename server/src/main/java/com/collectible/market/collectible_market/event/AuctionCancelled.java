package com.collectible.market.collectible_market.event;

import lombok.Value;

@Value
public class AuctionCancelled implements MarketEvent {
    long auctionId;
    String seller;
    long assetId;
}
