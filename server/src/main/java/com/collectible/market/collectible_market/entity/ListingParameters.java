package com.collectible.market.collectible_market.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Seller input for creating or updating a listing.
 * A startTime of 0 means "now".
 */
@Getter
@Builder
@ToString
public class ListingParameters {
    private final long assetId;

    @Builder.Default
    private final int quantity = 1;

    private final String currency;
    private final Money pricePerUnit;
    private final long startTime;
    private final long endTime;
    private final boolean reserved;
}
