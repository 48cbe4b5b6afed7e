package com.collectible.market.collectible_market.event;

import com.collectible.market.collectible_market.entity.Money;

import lombok.Value;

@Value
public class ListingCreated implements MarketEvent {
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
