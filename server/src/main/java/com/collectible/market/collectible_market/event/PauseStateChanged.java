package com.collectible.market.collectible_market.event;

import lombok.Value;

@Value
public class PauseStateChanged implements MarketEvent {
    String admin;
    boolean paused;
}
