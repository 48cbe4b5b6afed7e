package com.collectible.market.collectible_market.entity;

/**
 * A settlement record keyed by a sequential id.
 */
public interface MarketRecord<T extends MarketRecord<T>> {

    Long getId();

    void setId(Long id);

    /**
     * Detached copy, including collections, used for undo snapshots and persistence.
     */
    T copy();
}
