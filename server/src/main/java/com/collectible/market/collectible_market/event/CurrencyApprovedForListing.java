package com.collectible.market.collectible_market.event;

import com.collectible.market.collectible_market.entity.Money;

import lombok.Value;

/**
 * A zero price means the currency was removed.
 */
@Value
public class CurrencyApprovedForListing implements MarketEvent {
    long listingId;
    String currency;
    Money pricePerUnit;
}
