package com.collectible.market.collectible_market.service;

import java.time.Clock;

import com.collectible.market.collectible_market.cache.DutchAuctionStore;
import com.collectible.market.collectible_market.engine.DutchPricingEngine;
import com.collectible.market.collectible_market.entity.DutchAuction;
import com.collectible.market.collectible_market.entity.Money;
import com.collectible.market.collectible_market.error.ErrorCode;
import com.collectible.market.collectible_market.error.MarketException;
import com.collectible.market.collectible_market.event.DutchAuctionBought;
import com.collectible.market.collectible_market.event.DutchAuctionCancelled;
import com.collectible.market.collectible_market.event.DutchAuctionCreated;
import com.collectible.market.collectible_market.execution.SettlementExecutor;
import com.collectible.market.collectible_market.execution.TransactionJournal;
import com.collectible.market.collectible_market.ledger.Currencies;
import com.collectible.market.collectible_market.ledger.OwnershipLedger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Descending-price auctions settled by the first buyer.
 *
 * Native buys keep the whole payment: overpayment is not refunded and the fee
 * is charged on what was paid. Token buys pull exactly the current price.
 */
@Slf4j
@RequiredArgsConstructor
public class DutchAuctionHouse {

    private final String houseAddress;
    private final DutchAuctionStore auctionStore;
    private final DutchPricingEngine pricingEngine;
    private final OwnershipLedger ownershipLedger;
    private final PayoutLedger payoutLedger;
    private final EscrowVault escrowVault;
    private final SettlementValidator validator;
    private final SystemState systemState;
    private final SettlementExecutor executor;
    private final TransactionJournal journal;
    private final Clock clock;

    /**
     * @param duration seconds until the price reaches endPrice
     * @return the auction id
     */
    public long createDutchAuction(String callerAddress, long assetId, Money startPrice, Money endPrice, long duration,
            int decayExponent, String currencyAddress) {
        String caller = Currencies.normalize(callerAddress);
        String currency = Currencies.normalize(currencyAddress);
        return executor.execute("createDutchAuction", () -> {
            validator.validateDutchAuction(caller, houseAddress, assetId, startPrice, endPrice, duration,
                    decayExponent, currency).orThrow();

            ownershipLedger.transfer(houseAddress, caller, houseAddress, assetId);

            long now = now();
            DutchAuction auction = auctionStore.insert(DutchAuction.builder()
                    .seller(caller)
                    .assetId(assetId)
                    .currency(currency)
                    .startPrice(startPrice)
                    .endPrice(endPrice)
                    .startTime(now)
                    .duration(duration)
                    .decayExponent(decayExponent)
                    .active(true)
                    .build());

            journal.emit(new DutchAuctionCreated(auction.getId(), caller, assetId, currency, startPrice, endPrice,
                    now, duration, decayExponent));
            log.info("Dutch auction created: id={}, seller={}, asset={}, price {} -> {} over {}s (k={})",
                    auction.getId(), caller, assetId, startPrice, endPrice, duration, decayExponent);
            return auction.getId();
        });
    }

    public Money getCurrentPrice(long auctionId) {
        return executor.read(() -> pricingEngine.currentPrice(auctionStore.get(auctionId), now()));
    }

    /**
     * @param payment native value sent, or the most the buyer will pay in a token auction
     */
    public void buy(String callerAddress, long auctionId, Money payment) {
        String caller = Currencies.normalize(callerAddress);
        executor.execute("buyDutchAuction", () -> {
            systemState.requireNotPaused();
            DutchAuction current = auctionStore.get(auctionId);
            if (!current.isActive()) {
                throw new MarketException(ErrorCode.NOT_ACTIVE, "Dutch auction " + auctionId + " is not active");
            }
            Money price = pricingEngine.currentPrice(current, now());
            if (payment.isLessThan(price)) {
                throw new MarketException(ErrorCode.INSUFFICIENT_PAYMENT,
                        String.format("Current price is %s, got %s", price, payment));
            }
            Money charged = Currencies.isNative(current.getCurrency()) ? payment : price;

            escrowVault.pull(caller, current.getCurrency(), charged);
            var split = payoutLedger.settleSale(current.getSeller(), current.getCurrency(), charged,
                    "dutch:" + auctionId);
            ownershipLedger.transfer(houseAddress, houseAddress, caller, current.getAssetId());

            DutchAuction auction = auctionStore.forUpdate(auctionId);
            auction.setActive(false);
            auction.setBuyer(caller);
            auction.setSoldPrice(charged);

            journal.emit(new DutchAuctionBought(auctionId, auction.getSeller(), caller, auction.getAssetId(),
                    auction.getCurrency(), charged, split.getFee()));
            log.info("Dutch auction bought: id={}, buyer={}, paid={}, price={}, fee={}",
                    auctionId, caller, charged, price, split.getFee());
        });
    }

    public void cancelDutchAuction(String callerAddress, long auctionId) {
        String caller = Currencies.normalize(callerAddress);
        executor.execute("cancelDutchAuction", () -> {
            DutchAuction current = auctionStore.get(auctionId);
            if (!current.getSeller().equals(caller)) {
                throw new MarketException(ErrorCode.NOT_CREATOR, caller + " did not create Dutch auction " + auctionId);
            }
            if (!current.isActive()) {
                throw new MarketException(ErrorCode.NOT_ACTIVE, "Dutch auction " + auctionId + " is not active");
            }

            DutchAuction auction = auctionStore.forUpdate(auctionId);
            ownershipLedger.transfer(houseAddress, houseAddress, caller, auction.getAssetId());
            auction.setActive(false);

            journal.emit(new DutchAuctionCancelled(auctionId, caller, auction.getAssetId()));
            log.info("Dutch auction cancelled: id={}", auctionId);
        });
    }

    public DutchAuction getAuction(long auctionId) {
        return executor.read(() -> auctionStore.get(auctionId).copy());
    }

    public long totalAuctions() {
        return executor.read(auctionStore::count);
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
