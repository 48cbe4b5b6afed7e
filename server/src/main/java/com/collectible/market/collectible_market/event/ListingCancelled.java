package com.collectible.market.collectible_market.event;

import lombok.Value;

@Value
public class ListingCancelled implements MarketEvent {
    long listingId;
    String seller;
}
