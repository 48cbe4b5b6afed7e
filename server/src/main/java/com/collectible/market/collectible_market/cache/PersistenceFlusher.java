package com.collectible.market.collectible_market.cache;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.scheduling.annotation.Scheduled;

import com.collectible.market.collectible_market.entity.LedgerEntry;
import com.collectible.market.collectible_market.entity.MarketRecord;
import com.collectible.market.collectible_market.execution.SettlementExecutor;
import com.collectible.market.collectible_market.repositories.CardSetRepository;
import com.collectible.market.collectible_market.repositories.DutchAuctionRepository;
import com.collectible.market.collectible_market.repositories.EnglishAuctionRepository;
import com.collectible.market.collectible_market.repositories.LedgerEntryRepository;
import com.collectible.market.collectible_market.repositories.ListingRepository;
import com.collectible.market.collectible_market.service.PayoutLedger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Write-behind of committed records to MongoDB.
 *
 * Dirty records are copied out on the settlement thread, so a flush never sees
 * a half-applied operation, and saved from the scheduler thread. A failed save
 * re-queues the records and never affects settlement.
 */
@Slf4j
@RequiredArgsConstructor
public class PersistenceFlusher {

    private final SettlementExecutor executor;
    private final CardSetStore cardSetStore;
    private final ListingStore listingStore;
    private final EnglishAuctionStore englishAuctionStore;
    private final DutchAuctionStore dutchAuctionStore;
    private final PayoutLedger payoutLedger;
    private final CardSetRepository cardSetRepository;
    private final ListingRepository listingRepository;
    private final EnglishAuctionRepository englishAuctionRepository;
    private final DutchAuctionRepository dutchAuctionRepository;
    private final LedgerEntryRepository ledgerEntryRepository;

    @Scheduled(fixedDelayString = "${market.persistence.flush-interval-ms:1000}")
    public void flush() {
        int saved = flushStore(cardSetStore, cardSetRepository)
                + flushStore(listingStore, listingRepository)
                + flushStore(englishAuctionStore, englishAuctionRepository)
                + flushStore(dutchAuctionStore, dutchAuctionRepository)
                + flushLedgerEntries();
        if (saved > 0) {
            log.debug("Persisted {} records", saved);
        }
    }

    private <T extends MarketRecord<T>> int flushStore(RecordStore<T> store, MongoRepository<T, Long> repository) {
        List<T> dirty = executor.read(store::drainDirty);
        if (dirty.isEmpty()) {
            return 0;
        }
        try {
            repository.saveAll(dirty);
            return dirty.size();
        } catch (Exception e) {
            log.error("Failed to persist {} {} records, will retry", dirty.size(), store.getRecordName(), e);
            store.markDirty(dirty);
            return 0;
        }
    }

    private int flushLedgerEntries() {
        List<LedgerEntry> entries = payoutLedger.drainNewEntries();
        if (entries.isEmpty()) {
            return 0;
        }
        try {
            ledgerEntryRepository.saveAll(entries);
            return entries.size();
        } catch (Exception e) {
            log.error("Failed to persist {} ledger entries, will retry", entries.size(), e);
            payoutLedger.requeueUnpersisted(entries);
            return 0;
        }
    }
}
