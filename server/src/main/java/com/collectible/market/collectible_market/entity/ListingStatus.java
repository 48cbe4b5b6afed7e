package com.collectible.market.collectible_market.entity;

/**
 * Listing lifecycle.
 *
 * Valid transitions:
 * - ACTIVE → COMPLETED (bought)
 * - ACTIVE → CANCELLED (seller cancelled)
 *
 * COMPLETED and CANCELLED are terminal.
 */
public enum ListingStatus {
    ACTIVE,
    COMPLETED,
    CANCELLED;

    public boolean canTransitionTo(ListingStatus newStatus) {
        return switch (this) {
            case ACTIVE -> newStatus == COMPLETED || newStatus == CANCELLED;
            case COMPLETED, CANCELLED -> false;
        };
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
