package com.collectible.market.collectible_market.event;

import com.collectible.market.collectible_market.entity.Money;

import lombok.Value;

@Value
public class DutchAuctionBought implements MarketEvent {
    long auctionId;
    String seller;
    String buyer;
    long assetId;
    String currency;
    Money price;
    Money marketplaceFee;
}
