package com.collectible.market.collectible_market.entity;

import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Descending-price auction settled by a single buy.
 * buyer and soldPrice are set once the auction is bought.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "dutch_auctions")
public class DutchAuction implements MarketRecord<DutchAuction> {

    @MongoId
    private Long id;

    @Indexed
    private String seller;

    private long assetId;
    private String currency;

    private Money startPrice;
    private Money endPrice;
    private long startTime;
    private long duration;
    private int decayExponent;

    @Builder.Default
    private boolean active = true;

    private String buyer;
    private Money soldPrice;

    public boolean isSold() {
        return buyer != null;
    }

    @Override
    public DutchAuction copy() {
        return toBuilder().build();
    }
}
