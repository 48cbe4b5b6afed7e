package com.collectible.market.collectible_market.entity;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import com.collectible.market.collectible_market.ledger.Currencies;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Fixed-price sale of an asset the seller keeps custody of until the sale.
 *
 * The book never holds the asset. Ownership and operator approval are
 * checked again at buy time, so a seller that moved the asset or revoked
 * approval makes the listing unbuyable without touching it.
 *
 * At most one ACTIVE listing exists per (seller, assetId). Addresses are held
 * in canonical form (see {@link Currencies#normalize}).
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "listings")
@CompoundIndex(name = "seller_asset_idx", def = "{'seller':1,'assetId':1,'status':1}")
public class Listing implements MarketRecord<Listing> {

    @MongoId
    private Long id;

    @Indexed
    private String seller;

    private long assetId;
    private int quantity;

    /**
     * Primary currency.
     */
    private String currency;
    private Money pricePerUnit;

    private long startTime;
    private long endTime;

    private boolean reserved;

    @Builder.Default
    private Set<String> approvedBuyers = new HashSet<>();

    /**
     * Alternate currency → price per unit.
     */
    @Builder.Default
    private Map<String, Money> approvedCurrencies = new HashMap<>();

    @Builder.Default
    private ListingStatus status = ListingStatus.ACTIVE;

    public boolean isActive() {
        return status == ListingStatus.ACTIVE;
    }

    public boolean isOpenAt(long now) {
        return now >= startTime && now <= endTime;
    }

    public boolean isBuyerApproved(String buyer) {
        return !reserved || approvedBuyers.contains(Currencies.normalize(buyer));
    }

    /**
     * Price per unit in the given currency, or null if that currency is not accepted.
     */
    public Money priceIn(String currency) {
        if (this.currency.equalsIgnoreCase(currency)) {
            return pricePerUnit;
        }
        return approvedCurrencies.get(Currencies.normalize(currency));
    }

    public boolean isNativeCurrency() {
        return Currencies.isNative(currency);
    }

    public void applyParameters(ListingParameters params, long startTime) {
        this.assetId = params.getAssetId();
        this.quantity = params.getQuantity();
        this.currency = Currencies.normalize(params.getCurrency());
        this.pricePerUnit = params.getPricePerUnit();
        this.startTime = startTime;
        this.endTime = params.getEndTime();
        this.reserved = params.isReserved();
    }

    public void transitionTo(ListingStatus newStatus) {
        if (!status.canTransitionTo(newStatus)) {
            throw new IllegalStateException(
                    String.format("Invalid listing transition: %s -> %s (listing %d)", status, newStatus, id));
        }
        this.status = newStatus;
    }

    @Override
    public Listing copy() {
        return toBuilder()
                .approvedBuyers(new HashSet<>(approvedBuyers))
                .approvedCurrencies(new HashMap<>(approvedCurrencies))
                .build();
    }
}
