package com.collectible.market.collectible_market.service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.collectible.market.collectible_market.cache.CardSetStore;
import com.collectible.market.collectible_market.engine.SeedSource;
import com.collectible.market.collectible_market.engine.WeightedDraw;
import com.collectible.market.collectible_market.entity.CardSet;
import com.collectible.market.collectible_market.entity.LedgerEntryType;
import com.collectible.market.collectible_market.entity.Money;
import com.collectible.market.collectible_market.error.ErrorCode;
import com.collectible.market.collectible_market.error.MarketException;
import com.collectible.market.collectible_market.event.CardMinted;
import com.collectible.market.collectible_market.event.CardSetBurned;
import com.collectible.market.collectible_market.event.CardSetCreated;
import com.collectible.market.collectible_market.event.SecretSaltUpdated;
import com.collectible.market.collectible_market.execution.SettlementExecutor;
import com.collectible.market.collectible_market.execution.TransactionJournal;
import com.collectible.market.collectible_market.ledger.Currencies;
import com.collectible.market.collectible_market.ledger.OwnershipLedger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Card packs minted by weighted draw.
 *
 * Mint flow:
 * 1. Pause, availability, supply and exact payment checks
 * 2. Pull the payment into escrow and credit it to the admin treasury
 * 3. Draw a card index from the set's weights
 * 4. Mint a token bound to that card's URI to the caller
 * 5. Decrement remaining supply
 *
 * Mints are paid in the native currency only.
 */
@Slf4j
@RequiredArgsConstructor
public class CardSetRegistry {

    private final CardSetStore cardSetStore;
    private final OwnershipLedger ownershipLedger;
    private final PayoutLedger payoutLedger;
    private final EscrowVault escrowVault;
    private final SettlementValidator validator;
    private final SeedSource seedSource;
    private final WeightedDraw weightedDraw;
    private final SystemState systemState;
    private final SettlementExecutor executor;
    private final TransactionJournal journal;
    private final Clock clock;

    private Long lastMintedTokenId;

    public long createCardSet(String callerAddress, String name, List<String> cardUris, List<Integer> probabilities,
            long supply, Money price) {
        String caller = Currencies.normalize(callerAddress);
        return executor.execute("createCardSet", () -> {
            systemState.requireAdmin(caller);
            validator.validateCardSet(cardUris, probabilities).orThrow();
            if (supply < 0) {
                throw new MarketException(ErrorCode.INVALID_PARAMS, "Supply cannot be negative");
            }

            CardSet cardSet = cardSetStore.insert(CardSet.builder()
                    .name(name)
                    .cardUris(new ArrayList<>(cardUris))
                    .probabilities(new ArrayList<>(probabilities))
                    .remainingSupply(supply)
                    .price(price)
                    .createdAt(now())
                    .build());

            journal.emit(new CardSetCreated(cardSet.getId(), name, cardUris.size(), supply, price));
            log.info("Card set created: id={}, name={}, cards={}, supply={}, price={}",
                    cardSet.getId(), name, cardUris.size(), supply, price);
            return cardSet.getId();
        });
    }

    public void burnCardSet(String callerAddress, long cardSetId) {
        String caller = Currencies.normalize(callerAddress);
        executor.execute("burnCardSet", () -> {
            systemState.requireAdmin(caller);
            CardSet cardSet = cardSetStore.find(cardSetId)
                    .filter(set -> !set.isBurned())
                    .orElseThrow(() -> new MarketException(ErrorCode.NOT_FOUND,
                            "Card set does not exist or was burned: " + cardSetId));

            cardSetStore.forUpdate(cardSet.getId()).setBurned(true);

            journal.emit(new CardSetBurned(cardSetId, caller));
            log.info("Card set burned: id={}", cardSetId);
        });
    }

    /**
     * @return the id of the minted token
     */
    public long mintFromCardSet(String callerAddress, long cardSetId, Money payment) {
        String caller = Currencies.normalize(callerAddress);
        return executor.execute("mintFromCardSet", () -> {
            systemState.requireNotPaused();
            CardSet cardSet = cardSetStore.find(cardSetId)
                    .filter(set -> !set.isBurned())
                    .orElseThrow(() -> new MarketException(ErrorCode.NOT_FOUND,
                            "Card set does not exist or was burned: " + cardSetId));
            if (cardSet.isSoldOut()) {
                throw new MarketException(ErrorCode.SOLD_OUT, "Card set " + cardSetId + " is sold out");
            }
            if (!payment.equals(cardSet.getPrice())) {
                throw new MarketException(ErrorCode.WRONG_PAYMENT,
                        String.format("Expected %s, got %s", cardSet.getPrice(), payment));
            }

            escrowVault.pull(caller, Currencies.NATIVE_TOKEN, payment);
            payoutLedger.credit(systemState.getAdmin(), Currencies.NATIVE_TOKEN, payment,
                    LedgerEntryType.MINT_PROCEEDS, "cardSet:" + cardSetId);

            BigInteger seed = seedSource.nextSeed(caller);
            int cardIndex = weightedDraw.select(cardSet.getProbabilities(), seed);
            String uri = cardSet.getCardUris().get(cardIndex);
            long tokenId = ownershipLedger.mint(caller, uri);

            CardSet updated = cardSetStore.forUpdate(cardSetId);
            updated.decrementSupply();

            Long previousLastMinted = lastMintedTokenId;
            journal.record(() -> lastMintedTokenId = previousLastMinted);
            lastMintedTokenId = tokenId;

            journal.emit(new CardMinted(cardSetId, tokenId, caller, cardIndex, uri,
                    updated.getRemainingSupply(), payment));
            log.info("Card minted: set={}, token={}, card={}, minter={}, remaining={}",
                    cardSetId, tokenId, cardIndex, caller, updated.getRemainingSupply());
            return tokenId;
        });
    }

    public void updateSecretSalt(String callerAddress) {
        String caller = Currencies.normalize(callerAddress);
        executor.execute("updateSecretSalt", () -> {
            systemState.requireAdmin(caller);
            seedSource.rotateSalt();
            journal.emit(new SecretSaltUpdated(caller));
        });
    }

    public CardSet getCardSet(long cardSetId) {
        return executor.read(() -> cardSetStore.get(cardSetId).copy());
    }

    public long getCardSetCount() {
        return executor.read(cardSetStore::count);
    }

    /**
     * Sets that are neither burned nor sold out, in id order.
     */
    public List<CardSet> getAvailableCardSets() {
        return executor.read(() -> cardSetStore.all().stream()
                .filter(CardSet::isAvailable)
                .sorted((a, b) -> Long.compare(a.getId(), b.getId()))
                .map(CardSet::copy)
                .collect(Collectors.toList()));
    }

    public long getLastMintedTokenId() {
        return executor.read(() -> {
            if (lastMintedTokenId == null) {
                throw new MarketException(ErrorCode.NOT_FOUND, "No tokens minted yet");
            }
            return lastMintedTokenId;
        });
    }

    public String tokenUri(long tokenId) {
        return executor.read(() -> ownershipLedger.tokenUri(tokenId));
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
