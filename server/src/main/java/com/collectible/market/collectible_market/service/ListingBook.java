package com.collectible.market.collectible_market.service;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

import com.collectible.market.collectible_market.cache.ListingStore;
import com.collectible.market.collectible_market.entity.Listing;
import com.collectible.market.collectible_market.entity.ListingParameters;
import com.collectible.market.collectible_market.entity.ListingStatus;
import com.collectible.market.collectible_market.entity.Money;
import com.collectible.market.collectible_market.error.ErrorCode;
import com.collectible.market.collectible_market.error.MarketException;
import com.collectible.market.collectible_market.event.BuyerApprovedForListing;
import com.collectible.market.collectible_market.event.CurrencyApprovedForListing;
import com.collectible.market.collectible_market.event.ListingCancelled;
import com.collectible.market.collectible_market.event.ListingCreated;
import com.collectible.market.collectible_market.event.ListingUpdated;
import com.collectible.market.collectible_market.event.NewSale;
import com.collectible.market.collectible_market.execution.SettlementExecutor;
import com.collectible.market.collectible_market.execution.TransactionJournal;
import com.collectible.market.collectible_market.ledger.Currencies;
import com.collectible.market.collectible_market.ledger.OwnershipLedger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed-price listings.
 *
 * The seller keeps the asset until a buy; the book only needs to be an
 * approved operator. Buy flow:
 * 1. Listing, window, buyer and currency checks
 * 2. Price and payment checks
 * 3. Pull payment into escrow
 * 4. Credit fee and seller proceeds to the payout ledger
 * 5. Move the asset from the seller to the recipient
 * 6. Mark the listing COMPLETED
 */
@Slf4j
@RequiredArgsConstructor
public class ListingBook {

    private final String bookAddress;
    private final ListingStore listingStore;
    private final OwnershipLedger ownershipLedger;
    private final PayoutLedger payoutLedger;
    private final EscrowVault escrowVault;
    private final SettlementValidator validator;
    private final SystemState systemState;
    private final SettlementExecutor executor;
    private final TransactionJournal journal;
    private final Clock clock;

    /**
     * Create a listing, or overwrite the caller's active listing of the same asset.
     *
     * @return the listing id
     */
    public long createListing(String callerAddress, ListingParameters params) {
        String caller = Currencies.normalize(callerAddress);
        return executor.execute("createListing", () -> {
            long startTime = resolveStartTime(params.getStartTime());
            validator.validateListing(caller, bookAddress, params, startTime).orThrow();

            var existing = listingStore.findActive(caller, params.getAssetId());
            if (existing.isPresent()) {
                Listing listing = listingStore.forUpdate(existing.get().getId());
                listing.applyParameters(params, startTime);
                emitUpdated(listing);
                log.info("Listing overwritten: id={}, seller={}, asset={}, price={}",
                        listing.getId(), caller, listing.getAssetId(), listing.getPricePerUnit());
                return listing.getId();
            }

            Listing listing = Listing.builder()
                    .seller(caller)
                    .status(ListingStatus.ACTIVE)
                    .build();
            listing.applyParameters(params, startTime);
            listingStore.insert(listing);
            listingStore.indexActive(listing);

            journal.emit(new ListingCreated(listing.getId(), caller, listing.getAssetId(), listing.getQuantity(),
                    listing.getCurrency(), listing.getPricePerUnit(), listing.getStartTime(),
                    listing.getEndTime(), listing.isReserved()));
            log.info("Listing created: id={}, seller={}, asset={}, price={} {}",
                    listing.getId(), caller, listing.getAssetId(), listing.getPricePerUnit(), listing.getCurrency());
            return listing.getId();
        });
    }

    public void updateListing(String callerAddress, long listingId, ListingParameters params) {
        String caller = Currencies.normalize(callerAddress);
        executor.execute("updateListing", () -> {
            Listing current = requireActiveByCreator(caller, listingId);
            long startTime = resolveStartTime(params.getStartTime());
            validator.validateListing(caller, bookAddress, params, startTime).orThrow();
            if (params.getAssetId() != current.getAssetId()) {
                throw new MarketException(ErrorCode.INVALID_PARAMS, "Listing asset cannot change");
            }

            Listing listing = listingStore.forUpdate(listingId);
            listing.applyParameters(params, startTime);
            emitUpdated(listing);
            log.info("Listing updated: id={}, price={}, window=[{}, {}]",
                    listingId, listing.getPricePerUnit(), listing.getStartTime(), listing.getEndTime());
        });
    }

    public void cancelListing(String callerAddress, long listingId) {
        String caller = Currencies.normalize(callerAddress);
        executor.execute("cancelListing", () -> {
            requireActiveByCreator(caller, listingId);
            Listing listing = listingStore.forUpdate(listingId);
            listing.transitionTo(ListingStatus.CANCELLED);
            listingStore.unindex(listing);

            journal.emit(new ListingCancelled(listingId, caller));
            log.info("Listing cancelled: id={}", listingId);
        });
    }

    public void approveBuyerForListing(String callerAddress, long listingId, String buyerAddress,
            boolean approved) {
        String caller = Currencies.normalize(callerAddress);
        String buyer = Currencies.normalize(buyerAddress);
        executor.execute("approveBuyerForListing", () -> {
            Listing current = requireActiveByCreator(caller, listingId);
            if (!current.isReserved()) {
                throw new MarketException(ErrorCode.NOT_RESERVED, "Listing " + listingId + " is not reserved");
            }
            Listing listing = listingStore.forUpdate(listingId);
            if (approved) {
                listing.getApprovedBuyers().add(buyer);
            } else {
                listing.getApprovedBuyers().remove(buyer);
            }
            journal.emit(new BuyerApprovedForListing(listingId, buyer, approved));
            log.info("Buyer {} for listing {}: {}", approved ? "approved" : "removed", listingId, buyer);
        });
    }

    /**
     * Accept an alternate currency at its own price. A zero price removes it.
     */
    public void approveCurrencyForListing(String callerAddress, long listingId, String currencyAddress,
            Money pricePerUnit) {
        String caller = Currencies.normalize(callerAddress);
        String currency = Currencies.normalize(currencyAddress);
        executor.execute("approveCurrencyForListing", () -> {
            Listing current = requireActiveByCreator(caller, listingId);
            if (Currencies.isZeroAddress(currency) || current.getCurrency().equalsIgnoreCase(currency)) {
                throw new MarketException(ErrorCode.INVALID_CURRENCY,
                        "Cannot approve the zero address or the primary currency: " + currency);
            }
            Listing listing = listingStore.forUpdate(listingId);
            if (pricePerUnit.isZero()) {
                listing.getApprovedCurrencies().remove(currency);
            } else {
                listing.getApprovedCurrencies().put(currency, pricePerUnit);
            }
            journal.emit(new CurrencyApprovedForListing(listingId, currency, pricePerUnit));
            log.info("Currency {} for listing {} priced {}", currency, listingId, pricePerUnit);
        });
    }

    /**
     * Buy an active listing for {@code buyForAddress}. {@code value} is the native amount
     * sent with the call and must be zero when paying in a token.
     */
    public void buyFromListing(String callerAddress, long listingId, String buyForAddress, int quantity,
            String currencyAddress, Money expectedTotalPrice, Money value) {
        String caller = Currencies.normalize(callerAddress);
        String buyFor = Currencies.normalize(buyForAddress);
        String currency = Currencies.normalize(currencyAddress);
        executor.execute("buyFromListing", () -> {
            systemState.requireNotPaused();
            Listing current = listingStore.get(listingId);
            if (!current.isActive()) {
                throw new MarketException(ErrorCode.NOT_ACTIVE, "Listing " + listingId + " is " + current.getStatus());
            }
            if (quantity != current.getQuantity()) {
                throw new MarketException(ErrorCode.INVALID_QUANTITY,
                        String.format("Requested %d, listed %d", quantity, current.getQuantity()));
            }
            long now = now();
            if (now < current.getStartTime()) {
                throw new MarketException(ErrorCode.NOT_STARTED, "Listing " + listingId + " starts at " + current.getStartTime());
            }
            if (now > current.getEndTime()) {
                throw new MarketException(ErrorCode.EXPIRED, "Listing " + listingId + " ended at " + current.getEndTime());
            }
            if (!current.isBuyerApproved(buyFor)) {
                throw new MarketException(ErrorCode.NOT_APPROVED_BUYER, buyFor + " is not approved for listing " + listingId);
            }
            Money unitPrice = current.priceIn(currency);
            if (unitPrice == null) {
                throw new MarketException(ErrorCode.CURRENCY_NOT_ACCEPTED, currency);
            }
            Money totalPrice = unitPrice.multiply(quantity);
            if (!totalPrice.equals(expectedTotalPrice)) {
                throw new MarketException(ErrorCode.PRICE_MISMATCH,
                        String.format("Expected %s, listing asks %s", expectedTotalPrice, totalPrice));
            }
            Money requiredValue = Currencies.isNative(currency) ? totalPrice : Money.ZERO;
            if (!value.equals(requiredValue)) {
                throw new MarketException(ErrorCode.PAYMENT_MISMATCH,
                        String.format("Sent %s native, expected %s", value, requiredValue));
            }

            escrowVault.pull(caller, currency, totalPrice);
            var split = payoutLedger.settleSale(current.getSeller(), currency, totalPrice, "listing:" + listingId);
            ownershipLedger.transfer(bookAddress, current.getSeller(), buyFor, current.getAssetId());

            Listing listing = listingStore.forUpdate(listingId);
            listing.transitionTo(ListingStatus.COMPLETED);
            listingStore.unindex(listing);

            journal.emit(new NewSale(listingId, listing.getSeller(), buyFor, listing.getAssetId(), quantity,
                    currency, totalPrice, split.getFee()));
            log.info("Listing sold: id={}, buyer={}, total={} {}, fee={}",
                    listingId, buyFor, totalPrice, currency, split.getFee());
        });
    }

    public Listing getListing(long listingId) {
        return executor.read(() -> listingStore.get(listingId).copy());
    }

    public long totalListings() {
        return executor.read(listingStore::count);
    }

    public List<Listing> getAllListings(long start, long end) {
        return executor.read(() -> listingStore.range(start, end).stream()
                .map(Listing::copy)
                .collect(Collectors.toList()));
    }

    /**
     * Listings in the range that could be bought right now.
     */
    public List<Listing> getAllValidListings(long start, long end) {
        return executor.read(() -> {
            long now = now();
            return listingStore.range(start, end).stream()
                    .filter(listing -> isValid(listing, now))
                    .map(Listing::copy)
                    .collect(Collectors.toList());
        });
    }

    public boolean isBuyerApprovedForListing(long listingId, String buyerAddress) {
        String buyer = Currencies.normalize(buyerAddress);
        return executor.read(() -> listingStore.get(listingId).getApprovedBuyers().contains(buyer));
    }

    /**
     * @throws MarketException CURRENCY_NOT_ACCEPTED if the listing does not take the currency
     */
    public Money currencyPriceForListing(long listingId, String currencyAddress) {
        String currency = Currencies.normalize(currencyAddress);
        return executor.read(() -> {
            Money price = listingStore.get(listingId).priceIn(currency);
            if (price == null) {
                throw new MarketException(ErrorCode.CURRENCY_NOT_ACCEPTED, currency);
            }
            return price;
        });
    }

    private boolean isValid(Listing listing, long now) {
        return listing.isActive()
                && listing.isOpenAt(now)
                && ownershipLedger.exists(listing.getAssetId())
                && ownershipLedger.ownerOf(listing.getAssetId()).equals(listing.getSeller())
                && ownershipLedger.canOperate(bookAddress, listing.getAssetId());
    }

    private Listing requireActiveByCreator(String caller, long listingId) {
        Listing listing = listingStore.get(listingId);
        if (!listing.getSeller().equals(caller)) {
            throw new MarketException(ErrorCode.NOT_CREATOR, caller + " did not create listing " + listingId);
        }
        if (!listing.isActive()) {
            throw new MarketException(ErrorCode.NOT_ACTIVE, "Listing " + listingId + " is " + listing.getStatus());
        }
        return listing;
    }

    private void emitUpdated(Listing listing) {
        journal.emit(new ListingUpdated(listing.getId(), listing.getSeller(), listing.getAssetId(),
                listing.getQuantity(), listing.getCurrency(), listing.getPricePerUnit(), listing.getStartTime(),
                listing.getEndTime(), listing.isReserved()));
    }

    private long resolveStartTime(long requested) {
        return requested == 0 ? now() : requested;
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
