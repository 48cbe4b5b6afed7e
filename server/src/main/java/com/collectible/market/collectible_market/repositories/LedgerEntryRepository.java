package com.collectible.market.collectible_market.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.collectible.market.collectible_market.entity.LedgerEntry;

@Repository
public interface LedgerEntryRepository extends MongoRepository<LedgerEntry, Long> {
    List<LedgerEntry> findByAccountOrderByTimestampDesc(String account);

    /**
     * Latest entry for an (account, currency) pair; its balanceAfter is the
     * persisted withdrawable balance.
     */
    LedgerEntry findTopByAccountAndCurrencyOrderByIdDesc(String account, String currency);
}
