package com.collectible.market.collectible_market.event;

import lombok.Value;

/**
 * Salt values are never published.
 */
@Value
public class SecretSaltUpdated implements MarketEvent {
    String admin;
}
