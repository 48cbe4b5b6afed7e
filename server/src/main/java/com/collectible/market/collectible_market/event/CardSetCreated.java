package com.collectible.market.collectible_market.event;

import com.collectible.market.collectible_market.entity.Money;

import lombok.Value;

@Value
public class CardSetCreated implements MarketEvent {
    long cardSetId;
    String name;
    int cardCount;
    long supply;
    Money price;
}
