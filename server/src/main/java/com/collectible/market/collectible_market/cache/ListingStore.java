package com.collectible.market.collectible_market.cache;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.collectible.market.collectible_market.entity.Listing;
import com.collectible.market.collectible_market.execution.TransactionJournal;

/**
 * Listing arena plus an index of the single active listing per (seller, assetId).
 */
public class ListingStore extends RecordStore<Listing> {

    private final ConcurrentHashMap<String, Long> activeBySellerAndAsset = new ConcurrentHashMap<>();

    public ListingStore(TransactionJournal journal) {
        super("Listing", journal);
    }

    public Optional<Listing> findActive(String seller, long assetId) {
        Long id = activeBySellerAndAsset.get(key(seller, assetId));
        return id == null ? Optional.empty() : find(id).filter(Listing::isActive);
    }

    public void indexActive(Listing listing) {
        String key = key(listing.getSeller(), listing.getAssetId());
        Long previous = activeBySellerAndAsset.put(key, listing.getId());
        journal().record(() -> restore(key, previous));
    }

    public void unindex(Listing listing) {
        String key = key(listing.getSeller(), listing.getAssetId());
        Long previous = activeBySellerAndAsset.remove(key);
        journal().record(() -> restore(key, previous));
    }

    private void restore(String key, Long previous) {
        if (previous == null) {
            activeBySellerAndAsset.remove(key);
        } else {
            activeBySellerAndAsset.put(key, previous);
        }
    }

    private static String key(String seller, long assetId) {
        return seller + ":" + assetId;
    }
}
