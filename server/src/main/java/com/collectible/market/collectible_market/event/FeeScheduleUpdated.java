package com.collectible.market.collectible_market.event;

import lombok.Value;

@Value
public class FeeScheduleUpdated implements MarketEvent {
    String admin;
    int marketplaceFeeBps;
    String feeRecipient;
}
