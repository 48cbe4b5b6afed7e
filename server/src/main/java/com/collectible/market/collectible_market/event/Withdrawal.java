package com.collectible.market.collectible_market.event;

import com.collectible.market.collectible_market.entity.Money;

import lombok.Value;

@Value
public class Withdrawal implements MarketEvent {
    String account;
    String currency;
    Money amount;
}
