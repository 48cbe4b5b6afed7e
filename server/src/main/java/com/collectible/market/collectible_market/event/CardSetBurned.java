package com.collectible.market.collectible_market.event;

import lombok.Value;

@Value
public class CardSetBurned implements MarketEvent {
    long cardSetId;
    String admin;
}
