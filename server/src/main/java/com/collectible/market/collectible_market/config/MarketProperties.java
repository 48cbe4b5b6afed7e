package com.collectible.market.collectible_market.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

/**
 * Settlement engine settings. Addresses are ledger accounts owned by the engine.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "market")
public class MarketProperties {

    /**
     * Account allowed to manage card sets, fees and the pause switch.
     * Also receives mint proceeds.
     */
    private String admin;

    /**
     * Custody account for all funds between payment and withdrawal.
     */
    private String escrowAddress;

    /**
     * Operator address sellers approve so listings can be bought.
     */
    private String listingBookAddress;

    /**
     * Holds assets of English auctions.
     */
    private String auctionHouseAddress;

    /**
     * Holds assets of Dutch auctions.
     */
    private String dutchAuctionAddress;

    private int marketplaceFeeBps = 250;
    private String feeRecipient;

    private Persistence persistence = new Persistence();

    @Getter
    @Setter
    public static class Persistence {
        private long flushIntervalMs = 1000;
    }
}
