package com.collectible.market.collectible_market.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.collectible.market.collectible_market.cache.CardSetStore;
import com.collectible.market.collectible_market.cache.DutchAuctionStore;
import com.collectible.market.collectible_market.cache.EnglishAuctionStore;
import com.collectible.market.collectible_market.cache.ListingStore;
import com.collectible.market.collectible_market.cache.PersistenceFlusher;
import com.collectible.market.collectible_market.engine.BlockEntropySeedSource;
import com.collectible.market.collectible_market.engine.DutchPricingEngine;
import com.collectible.market.collectible_market.engine.SeedSource;
import com.collectible.market.collectible_market.engine.WeightedDraw;
import com.collectible.market.collectible_market.event.SettlementEventLogger;
import com.collectible.market.collectible_market.execution.SettlementExecutor;
import com.collectible.market.collectible_market.execution.TransactionJournal;
import com.collectible.market.collectible_market.ledger.CurrencyLedger;
import com.collectible.market.collectible_market.ledger.InMemoryCurrencyLedger;
import com.collectible.market.collectible_market.ledger.InMemoryOwnershipLedger;
import com.collectible.market.collectible_market.ledger.OwnershipLedger;
import com.collectible.market.collectible_market.repositories.CardSetRepository;
import com.collectible.market.collectible_market.repositories.DutchAuctionRepository;
import com.collectible.market.collectible_market.repositories.EnglishAuctionRepository;
import com.collectible.market.collectible_market.repositories.LedgerEntryRepository;
import com.collectible.market.collectible_market.repositories.ListingRepository;
import com.collectible.market.collectible_market.service.CardSetRegistry;
import com.collectible.market.collectible_market.service.DutchAuctionHouse;
import com.collectible.market.collectible_market.service.EnglishAuctionHouse;
import com.collectible.market.collectible_market.service.EscrowVault;
import com.collectible.market.collectible_market.service.FeeSchedule;
import com.collectible.market.collectible_market.service.ListingBook;
import com.collectible.market.collectible_market.service.PayoutLedger;
import com.collectible.market.collectible_market.service.SettlementValidator;
import com.collectible.market.collectible_market.service.SystemState;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(MarketProperties.class)
public class MarketConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TransactionJournal transactionJournal() {
        return new TransactionJournal();
    }

    @Bean(destroyMethod = "shutdown")
    public SettlementExecutor settlementExecutor(TransactionJournal journal, ApplicationEventPublisher eventPublisher) {
        return new SettlementExecutor(journal, eventPublisher);
    }

    @Bean
    public OwnershipLedger ownershipLedger(TransactionJournal journal) {
        return new InMemoryOwnershipLedger(journal);
    }

    @Bean
    public CurrencyLedger currencyLedger(TransactionJournal journal) {
        return new InMemoryCurrencyLedger(journal);
    }

    @Bean
    public CardSetStore cardSetStore(TransactionJournal journal) {
        return new CardSetStore(journal);
    }

    @Bean
    public ListingStore listingStore(TransactionJournal journal) {
        return new ListingStore(journal);
    }

    @Bean
    public EnglishAuctionStore englishAuctionStore(TransactionJournal journal) {
        return new EnglishAuctionStore(journal);
    }

    @Bean
    public DutchAuctionStore dutchAuctionStore(TransactionJournal journal) {
        return new DutchAuctionStore(journal);
    }

    @Bean
    WeightedDraw weightedDraw() {
        return new WeightedDraw();
    }

    @Bean
    SeedSource seedSource(Clock clock, TransactionJournal journal) {
        return new BlockEntropySeedSource(clock, journal);
    }

    @Bean
    DutchPricingEngine dutchPricingEngine() {
        return new DutchPricingEngine();
    }

    @Bean
    public SystemState systemState(MarketProperties properties, SettlementExecutor executor,
            TransactionJournal journal) {
        return new SystemState(properties.getAdmin(), executor, journal);
    }

    @Bean
    public FeeSchedule feeSchedule(MarketProperties properties, SystemState systemState,
            SettlementExecutor executor, TransactionJournal journal) {
        return new FeeSchedule(properties.getMarketplaceFeeBps(), properties.getFeeRecipient(), systemState,
                executor, journal);
    }

    @Bean
    public EscrowVault escrowVault(MarketProperties properties, CurrencyLedger currencyLedger) {
        return new EscrowVault(currencyLedger, properties.getEscrowAddress());
    }

    @Bean
    public CardSetRegistry cardSetRegistry(CardSetStore store, OwnershipLedger ownershipLedger,
            PayoutLedger payoutLedger, EscrowVault escrowVault, SettlementValidator validator,
            SeedSource seedSource, WeightedDraw weightedDraw, SystemState systemState,
            SettlementExecutor executor, TransactionJournal journal, Clock clock) {
        return new CardSetRegistry(store, ownershipLedger, payoutLedger, escrowVault, validator, seedSource,
                weightedDraw, systemState, executor, journal, clock);
    }

    @Bean
    public ListingBook listingBook(MarketProperties properties, ListingStore store,
            OwnershipLedger ownershipLedger, PayoutLedger payoutLedger, EscrowVault escrowVault,
            SettlementValidator validator, SystemState systemState, SettlementExecutor executor,
            TransactionJournal journal, Clock clock) {
        return new ListingBook(properties.getListingBookAddress(), store, ownershipLedger, payoutLedger,
                escrowVault, validator, systemState, executor, journal, clock);
    }

    @Bean
    public EnglishAuctionHouse englishAuctionHouse(MarketProperties properties, EnglishAuctionStore store,
            OwnershipLedger ownershipLedger, PayoutLedger payoutLedger, EscrowVault escrowVault,
            SettlementValidator validator, SystemState systemState, SettlementExecutor executor,
            TransactionJournal journal, Clock clock) {
        return new EnglishAuctionHouse(properties.getAuctionHouseAddress(), store, ownershipLedger, payoutLedger,
                escrowVault, validator, systemState, executor, journal, clock);
    }

    @Bean
    public DutchAuctionHouse dutchAuctionHouse(MarketProperties properties, DutchAuctionStore store,
            DutchPricingEngine pricingEngine, OwnershipLedger ownershipLedger, PayoutLedger payoutLedger,
            EscrowVault escrowVault, SettlementValidator validator, SystemState systemState,
            SettlementExecutor executor, TransactionJournal journal, Clock clock) {
        return new DutchAuctionHouse(properties.getDutchAuctionAddress(), store, pricingEngine, ownershipLedger,
                payoutLedger, escrowVault, validator, systemState, executor, journal, clock);
    }

    @Bean
    SettlementEventLogger settlementEventLogger() {
        return new SettlementEventLogger();
    }

    @Bean
    public PersistenceFlusher persistenceFlusher(SettlementExecutor executor, CardSetStore cardSetStore,
            ListingStore listingStore, EnglishAuctionStore englishAuctionStore,
            DutchAuctionStore dutchAuctionStore, PayoutLedger payoutLedger,
            CardSetRepository cardSetRepository, ListingRepository listingRepository,
            EnglishAuctionRepository englishAuctionRepository, DutchAuctionRepository dutchAuctionRepository,
            LedgerEntryRepository ledgerEntryRepository) {
        return new PersistenceFlusher(executor, cardSetStore, listingStore, englishAuctionStore,
                dutchAuctionStore, payoutLedger, cardSetRepository, listingRepository, englishAuctionRepository,
                dutchAuctionRepository, ledgerEntryRepository);
    }
}
