package com.collectible.market.collectible_market.event;

/**
 * A committed settlement transition. Each event carries the id, actor, amounts
 * and new status needed to rebuild the record without a read.
 */
public interface MarketEvent {
}
