package com.collectible.market.collectible_market.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Seller input for an English auction.
 *
 * buyoutBid of zero disables buyout. timeBuffer is in seconds.
 * A startTime of 0 means "now".
 */
@Getter
@Builder
@ToString
public class AuctionParameters {
    private final long assetId;

    @Builder.Default
    private final int quantity = 1;

    private final String currency;
    private final Money minBid;

    @Builder.Default
    private final Money buyoutBid = Money.ZERO;

    private final long timeBuffer;
    private final int bidBufferBps;
    private final long startTime;
    private final long endTime;
}
