package com.collectible.market.collectible_market.service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.collectible.market.collectible_market.entity.LedgerEntry;
import com.collectible.market.collectible_market.entity.LedgerEntryType;
import com.collectible.market.collectible_market.entity.Money;
import com.collectible.market.collectible_market.error.ErrorCode;
import com.collectible.market.collectible_market.error.MarketException;
import com.collectible.market.collectible_market.event.Withdrawal;
import com.collectible.market.collectible_market.execution.SettlementExecutor;
import com.collectible.market.collectible_market.execution.TransactionJournal;
import com.collectible.market.collectible_market.ledger.Currencies;

import lombok.RequiredArgsConstructor;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * Withdrawable balances of sellers, the fee recipient and the mint treasury.
 *
 * Every credit and debit appends a {@link LedgerEntry} carrying the running
 * balance, so the latest entry of an (account, currency) pair is its balance.
 * The funds themselves stay in the {@link EscrowVault} until withdrawn.
 *
 * Only the most recent entries stay in memory; the full history lives in the
 * ledger_entries collection.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PayoutLedger {

    private final EscrowVault escrowVault;
    private final FeeSchedule feeSchedule;
    private final SettlementExecutor executor;
    private final TransactionJournal journal;
    private final Clock clock;

    public static final int DEFAULT_RECENT_ENTRY_LIMIT = 10_000;

    private final ConcurrentHashMap<String, Money> balances = new ConcurrentHashMap<>();
    private final Deque<LedgerEntry> recentEntries = new ArrayDeque<>();
    private final List<LedgerEntry> unpersisted = new ArrayList<>();
    private long nextEntryId;

    @Setter
    @Value("${market.payouts.recent-entry-limit:10000}")
    private int recentEntryLimit = DEFAULT_RECENT_ENTRY_LIMIT;

    /**
     * Split a sale between the fee recipient and the seller and credit both.
     * Must run inside a settlement operation.
     */
    public FeeSchedule.FeeSplit settleSale(String seller, String currency, Money total, String reference) {
        FeeSchedule.FeeSplit split = feeSchedule.split(total);
        credit(feeSchedule.getFeeRecipient(), currency, split.getFee(), LedgerEntryType.MARKETPLACE_FEE, reference);
        credit(seller, currency, split.getProceeds(), LedgerEntryType.SALE_PROCEEDS, reference);
        return split;
    }

    /**
     * Must run inside a settlement operation. Zero amounts are ignored.
     */
    public void credit(String account, String currency, Money amount, LedgerEntryType type, String reference) {
        if (amount.isZero()) {
            return;
        }
        Money balanceAfter = currentBalance(account, currency).add(amount);
        apply(account, currency, amount, balanceAfter, type, reference);
        log.debug("Credited {} {} to {} ({}, {})", amount, currency, account, type, reference);
    }

    /**
     * Pay out the caller's whole balance in one currency.
     */
    public Money withdraw(String caller, String currency) {
        String account = Currencies.normalize(caller);
        String canonicalCurrency = Currencies.normalize(currency);
        return executor.execute("withdraw", () -> {
            Money amount = currentBalance(account, canonicalCurrency);
            if (amount.isZero()) {
                throw new MarketException(ErrorCode.NOTHING_TO_WITHDRAW,
                        String.format("%s has no %s balance", account, canonicalCurrency));
            }
            apply(account, canonicalCurrency, amount, Money.ZERO, LedgerEntryType.WITHDRAWAL, "withdraw");
            escrowVault.push(account, canonicalCurrency, amount);
            journal.emit(new Withdrawal(account, canonicalCurrency, amount));
            log.info("Withdrawal: account={}, currency={}, amount={}", account, canonicalCurrency, amount);
            return amount;
        });
    }

    public Money balanceOf(String account, String currency) {
        return executor.read(() -> currentBalance(account, currency));
    }

    /**
     * Recent entries of an account, oldest first. Older history is only in MongoDB.
     */
    public List<LedgerEntry> entriesFor(String account) {
        String canonical = Currencies.normalize(account);
        return executor.read(() -> recentEntries.stream()
                .filter(entry -> entry.getAccount().equals(canonical))
                .collect(Collectors.toList()));
    }

    /**
     * Entries appended since the last drain, for persistence.
     */
    public List<LedgerEntry> drainNewEntries() {
        return executor.read(() -> {
            List<LedgerEntry> drained = new ArrayList<>(unpersisted);
            unpersisted.clear();
            return drained;
        });
    }

    /**
     * Periodic reconciliation: escrow must always hold at least what the ledger owes.
     * Runs every 5 minutes.
     */
    @Scheduled(fixedDelay = 300000) // 5 minutes
    public void checkSolvency() {
        if (isSolvent()) {
            log.debug("Escrow covers all payout balances");
        } else {
            log.error("Escrow does not cover payout balances");
        }
    }

    /**
     * @return true if escrow covers the owed total of every currency
     */
    public boolean isSolvent() {
        Map<String, Money> owed = executor.read(() -> {
            Map<String, Money> totals = new HashMap<>();
            balances.forEach((key, amount) -> totals.merge(currencyOf(key), amount, Money::add));
            return totals;
        });
        boolean solvent = true;
        for (Map.Entry<String, Money> entry : owed.entrySet()) {
            Money held = escrowVault.heldIn(entry.getKey());
            if (held.isLessThan(entry.getValue())) {
                log.warn("Escrow shortfall in {}: owed={}, held={}", entry.getKey(), entry.getValue(), held);
                solvent = false;
            }
        }
        return solvent;
    }

    /**
     * Put back entries whose persistence failed, ahead of newer ones.
     */
    public void requeueUnpersisted(List<LedgerEntry> failed) {
        executor.read(() -> unpersisted.addAll(0, failed));
    }

    private Money currentBalance(String account, String currency) {
        return balances.getOrDefault(key(account, currency), Money.ZERO);
    }

    private void apply(String rawAccount, String rawCurrency, Money amount, Money balanceAfter,
            LedgerEntryType type, String reference) {
        String account = Currencies.normalize(rawAccount);
        String currency = Currencies.normalize(rawCurrency);
        String key = key(account, currency);
        Money previous = balances.get(key);
        long entryId = nextEntryId++;
        LedgerEntry entry = LedgerEntry.builder()
                .id(entryId)
                .account(account)
                .currency(currency)
                .entryType(type)
                .amount(amount)
                .balanceAfter(balanceAfter)
                .reference(reference)
                .timestamp(clock.instant().getEpochSecond())
                .build();
        balances.put(key, balanceAfter);
        recentEntries.addLast(entry);
        LedgerEntry evicted = recentEntries.size() > recentEntryLimit ? recentEntries.pollFirst() : null;
        unpersisted.add(entry);
        journal.record(() -> {
            if (previous == null) {
                balances.remove(key);
            } else {
                balances.put(key, previous);
            }
            recentEntries.removeLastOccurrence(entry);
            if (evicted != null) {
                recentEntries.addFirst(evicted);
            }
            unpersisted.remove(entry);
            nextEntryId = entryId;
        });
    }

    private static String key(String account, String currency) {
        return Currencies.normalize(account) + "|" + Currencies.normalize(currency);
    }

    private static String currencyOf(String key) {
        return key.substring(key.indexOf('|') + 1);
    }
}
