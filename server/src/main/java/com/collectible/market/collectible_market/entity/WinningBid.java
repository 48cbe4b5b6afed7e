package com.collectible.market.collectible_market.entity;

import lombok.Value;

@Value
public class WinningBid {
    String bidder;
    Money amount;
}
