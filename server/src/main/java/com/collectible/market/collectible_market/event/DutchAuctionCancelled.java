package com.collectible.market.collectible_market.event;

import lombok.Value;

@Value
public class DutchAuctionCancelled implements MarketEvent {
    long auctionId;
    String seller;
    long assetId;
}
