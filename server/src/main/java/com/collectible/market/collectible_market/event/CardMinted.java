package com.collectible.market.collectible_market.event;

import com.collectible.market.collectible_market.entity.Money;

import lombok.Value;

@Value
public class CardMinted implements MarketEvent {
    long cardSetId;
    long tokenId;
    String minter;
    int cardIndex;
    String tokenUri;
    long remainingSupply;
    Money price;
}
