package com.collectible.market.collectible_market.event;

import lombok.Value;

@Value
public class BuyerApprovedForListing implements MarketEvent {
    long listingId;
    String buyer;
    boolean approved;
}
