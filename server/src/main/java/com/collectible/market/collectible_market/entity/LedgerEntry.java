package com.collectible.market.collectible_market.entity;

import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Append-only journal row of the payout ledger.
 *
 * amount is always the magnitude; WITHDRAWAL rows are debits, every other type is a credit.
 * balanceAfter = balanceBefore ± amount for the (account, currency) pair.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "ledger_entries")
@CompoundIndex(name = "account_timestamp_idx", def = "{'account':1,'timestamp':-1}")
public class LedgerEntry {

    @MongoId
    private Long id;

    @Indexed
    private String account;

    private String currency;
    private LedgerEntryType entryType;
    private Money amount;
    private Money balanceAfter;

    /**
     * Source of the entry, e.g. "listing:3" or "auction:0".
     */
    private String reference;

    private long timestamp;
}
