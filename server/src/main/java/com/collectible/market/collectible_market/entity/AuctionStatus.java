package com.collectible.market.collectible_market.entity;

/**
 * English auction lifecycle.
 *
 * Valid transitions:
 * - CREATED → COMPLETED (buyout, token collection or payout collection)
 * - CREATED → CANCELLED (seller cancelled before any bid)
 */
public enum AuctionStatus {
    CREATED,
    COMPLETED,
    CANCELLED;

    public boolean canTransitionTo(AuctionStatus newStatus) {
        return switch (this) {
            case CREATED -> newStatus == COMPLETED || newStatus == CANCELLED;
            // the second collection call on a completed auction keeps it completed
            case COMPLETED -> newStatus == COMPLETED;
            case CANCELLED -> false;
        };
    }
}
