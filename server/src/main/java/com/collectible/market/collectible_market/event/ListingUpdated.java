package com.collectible.market.collectible_market.event;

import com.collectible.market.collectible_market.entity.Money;

import lombok.Value;

/**
 * Also published when a seller re-lists an asset that already has an active listing.
 */
@Value
public class ListingUpdated implements MarketEvent {
    long listingId;
    String seller;
    long assetId;
    int quantity;
    String currency;
    Money pricePerUnit;
    long startTime;
    long endTime;
    boolean reserved;
}
