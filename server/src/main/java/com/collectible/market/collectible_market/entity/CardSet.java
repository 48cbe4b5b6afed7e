package com.collectible.market.collectible_market.entity;

import java.util.ArrayList;
import java.util.List;

import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A mintable pack: a weighted pool of card URIs with a fixed supply and price.
 *
 * probabilities are basis points aligned with cardUris and always sum to 10000.
 * Burned sets are kept for history and never become available again.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "card_sets")
public class CardSet implements MarketRecord<CardSet> {

    @MongoId
    private Long id;

    private String name;

    @Builder.Default
    private List<String> cardUris = new ArrayList<>();

    @Builder.Default
    private List<Integer> probabilities = new ArrayList<>();

    private long remainingSupply;
    private Money price;

    @Builder.Default
    private boolean burned = false;

    private long createdAt;

    public boolean isAvailable() {
        return !burned && remainingSupply > 0;
    }

    public boolean isSoldOut() {
        return remainingSupply == 0;
    }

    public void decrementSupply() {
        if (remainingSupply <= 0) {
            throw new IllegalStateException("Card set " + id + " has no remaining supply");
        }
        remainingSupply--;
    }

    @Override
    public CardSet copy() {
        return toBuilder()
                .cardUris(new ArrayList<>(cardUris))
                .probabilities(new ArrayList<>(probabilities))
                .build();
    }
}
