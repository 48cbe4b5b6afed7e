package com.collectible.market.collectible_market.event;

import com.collectible.market.collectible_market.entity.Money;

import lombok.Value;

@Value
public class NewSale implements MarketEvent {
    long listingId;
    String seller;
    String buyer;
    long assetId;
    int quantity;
    String currency;
    Money totalPrice;
    Money marketplaceFee;
}
