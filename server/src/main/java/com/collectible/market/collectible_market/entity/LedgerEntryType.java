package com.collectible.market.collectible_market.entity;

public enum LedgerEntryType {
    SALE_PROCEEDS,
    MARKETPLACE_FEE,
    MINT_PROCEEDS,
    WITHDRAWAL;

    public boolean isDebit() {
        return this == WITHDRAWAL;
    }
}
