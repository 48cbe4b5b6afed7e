package com.collectible.market.collectible_market.support;

import com.collectible.market.collectible_market.cache.CardSetStore;
import com.collectible.market.collectible_market.cache.DutchAuctionStore;
import com.collectible.market.collectible_market.cache.EnglishAuctionStore;
import com.collectible.market.collectible_market.cache.ListingStore;
import com.collectible.market.collectible_market.engine.DutchPricingEngine;
import com.collectible.market.collectible_market.engine.WeightedDraw;
import com.collectible.market.collectible_market.entity.Money;
import com.collectible.market.collectible_market.execution.SettlementExecutor;
import com.collectible.market.collectible_market.execution.TransactionJournal;
import com.collectible.market.collectible_market.ledger.Currencies;
import com.collectible.market.collectible_market.ledger.InMemoryCurrencyLedger;
import com.collectible.market.collectible_market.ledger.InMemoryOwnershipLedger;
import com.collectible.market.collectible_market.service.CardSetRegistry;
import com.collectible.market.collectible_market.service.DutchAuctionHouse;
import com.collectible.market.collectible_market.service.EnglishAuctionHouse;
import com.collectible.market.collectible_market.service.EscrowVault;
import com.collectible.market.collectible_market.service.FeeSchedule;
import com.collectible.market.collectible_market.service.ListingBook;
import com.collectible.market.collectible_market.service.PayoutLedger;
import com.collectible.market.collectible_market.service.SettlementValidator;
import com.collectible.market.collectible_market.service.SystemState;

/**
 * Whole settlement engine wired by hand, without a Spring context or MongoDB.
 */
public class TestMarket implements AutoCloseable {

    public static final String ADMIN = "0x00000000000000000000000000000000000000a1";
    public static final String FEE_RECIPIENT = "0x00000000000000000000000000000000000000fe";
    public static final String ESCROW = "0x00000000000000000000000000000000000000e5";
    public static final String BOOK = "0x000000000000000000000000000000000000b00c";
    public static final String HOUSE = "0x000000000000000000000000000000000000a0c7";
    public static final String DUTCH = "0x000000000000000000000000000000000000d07c";

    public static final String ALICE = "0x00000000000000000000000000000000000a11ce";
    public static final String BOB = "0x0000000000000000000000000000000000000b0b";
    public static final String CAROL = "0x00000000000000000000000000000000000ca201";

    public static final String NATIVE = Currencies.NATIVE_TOKEN;
    public static final String TOKEN = "0x00000000000000000000000000000000000070c3";

    public static final int FEE_BPS = 250;
    public static final long START = 1_700_000_000L;

    public final MutableClock clock = new MutableClock(START);
    public final RecordingEventPublisher events = new RecordingEventPublisher();
    public final TransactionJournal journal = new TransactionJournal();
    public final SettlementExecutor executor = new SettlementExecutor(journal, events);

    public final InMemoryOwnershipLedger ownership = new InMemoryOwnershipLedger(journal);
    public final InMemoryCurrencyLedger currency = new InMemoryCurrencyLedger(journal);

    public final CardSetStore cardSetStore = new CardSetStore(journal);
    public final ListingStore listingStore = new ListingStore(journal);
    public final EnglishAuctionStore englishAuctionStore = new EnglishAuctionStore(journal);
    public final DutchAuctionStore dutchAuctionStore = new DutchAuctionStore(journal);

    public final FixedSeedSource seedSource = new FixedSeedSource();

    public final SystemState systemState = new SystemState(ADMIN, executor, journal);
    public final FeeSchedule feeSchedule = new FeeSchedule(FEE_BPS, FEE_RECIPIENT, systemState, executor, journal);
    public final EscrowVault escrow = new EscrowVault(currency, ESCROW);
    public final PayoutLedger payouts = new PayoutLedger(escrow, feeSchedule, executor, journal, clock);
    public final SettlementValidator validator = new SettlementValidator(ownership);

    public final CardSetRegistry cardSets = new CardSetRegistry(cardSetStore, ownership, payouts, escrow,
            validator, seedSource, new WeightedDraw(), systemState, executor, journal, clock);
    public final ListingBook listings = new ListingBook(BOOK, listingStore, ownership, payouts, escrow,
            validator, systemState, executor, journal, clock);
    public final EnglishAuctionHouse auctions = new EnglishAuctionHouse(HOUSE, englishAuctionStore, ownership,
            payouts, escrow, validator, systemState, executor, journal, clock);
    public final DutchAuctionHouse dutchAuctions = new DutchAuctionHouse(DUTCH, dutchAuctionStore,
            new DutchPricingEngine(), ownership, payouts, escrow, validator, systemState, executor, journal, clock);

    /**
     * Mint a plain asset straight on the ledger.
     */
    public long assetOwnedBy(String owner) {
        return ownership.mint(owner, "ipfs://asset");
    }

    /**
     * Mint an asset and approve an engine address to move it.
     */
    public long assetApprovedFor(String owner, String operator) {
        long assetId = assetOwnedBy(owner);
        ownership.setApprovalForAll(owner, operator, true);
        return assetId;
    }

    public void fund(String account, String amount) {
        currency.deposit(account, NATIVE, Money.of(amount));
    }

    public void fundToken(String account, String amount) {
        currency.deposit(account, TOKEN, Money.of(amount));
        currency.approve(account, ESCROW, TOKEN, Money.of(amount));
    }

    public Money nativeBalance(String account) {
        return currency.balanceOf(account, NATIVE);
    }

    public static Money eth(String amount) {
        return Money.of(amount);
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
