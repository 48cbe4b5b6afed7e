package com.collectible.market.collectible_market.event;

import org.springframework.context.event.EventListener;

import lombok.extern.slf4j.Slf4j;

/**
 * Audit trail of committed settlement transitions.
 */
@Slf4j
public class SettlementEventLogger {

    @EventListener
    public void onMarketEvent(MarketEvent event) {
        log.info("Settlement event: {}", event);
    }
}
