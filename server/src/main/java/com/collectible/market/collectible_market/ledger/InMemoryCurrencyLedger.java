package com.collectible.market.collectible_market.ledger;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.collectible.market.collectible_market.entity.Money;
import com.collectible.market.collectible_market.error.ErrorCode;
import com.collectible.market.collectible_market.error.MarketException;
import com.collectible.market.collectible_market.execution.TransactionJournal;

/**
 * In-process currency ledger with journaled balances and allowances.
 *
 * An account can be flagged to reject incoming transfers, which models a
 * recipient whose receive hook reverts.
 */
public class InMemoryCurrencyLedger implements CurrencyLedger {

    private final TransactionJournal journal;
    private final ConcurrentHashMap<String, Money> balances = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Money> allowances = new ConcurrentHashMap<>();
    private final Set<String> rejectingAccounts = ConcurrentHashMap.newKeySet();

    public InMemoryCurrencyLedger(TransactionJournal journal) {
        this.journal = journal;
    }

    @Override
    public Money balanceOf(String account, String currency) {
        return balances.getOrDefault(key(account, currency), Money.ZERO);
    }

    @Override
    public Money allowance(String owner, String spender, String currency) {
        return allowances.getOrDefault(key(owner, spender, currency), Money.ZERO);
    }

    @Override
    public void approve(String owner, String spender, String currency, Money amount) {
        put(allowances, key(owner, spender, currency), amount);
    }

    @Override
    public void deposit(String account, String currency, Money amount) {
        put(balances, key(account, currency), balanceOf(account, currency).add(amount));
    }

    @Override
    public void transfer(String from, String to, String currency, Money amount) {
        if (rejectingAccounts.contains(Currencies.normalize(to))) {
            throw new MarketException(ErrorCode.TRANSFER_REJECTED, "Recipient rejected transfer: " + to);
        }
        Money fromBalance = balanceOf(from, currency);
        if (fromBalance.isLessThan(amount)) {
            throw new MarketException(ErrorCode.INSUFFICIENT_BALANCE,
                    String.format("%s has %s, needs %s", from, fromBalance, amount));
        }
        put(balances, key(from, currency), fromBalance.subtract(amount));
        put(balances, key(to, currency), balanceOf(to, currency).add(amount));
    }

    @Override
    public void transferFrom(String spender, String from, String to, String currency, Money amount) {
        Money allowed = allowance(from, spender, currency);
        if (allowed.isLessThan(amount)) {
            throw new MarketException(ErrorCode.INSUFFICIENT_ALLOWANCE,
                    String.format("Check allowance: %s allowed %s, needs %s", from, allowed, amount));
        }
        put(allowances, key(from, spender, currency), allowed.subtract(amount));
        transfer(from, to, currency, amount);
    }

    /**
     * Make an account refuse (or accept again) incoming transfers.
     */
    public void setRejectIncoming(String account, boolean reject) {
        if (reject) {
            rejectingAccounts.add(Currencies.normalize(account));
        } else {
            rejectingAccounts.remove(Currencies.normalize(account));
        }
    }

    private void put(ConcurrentHashMap<String, Money> map, String key, Money value) {
        Money previous = map.get(key);
        journal.record(() -> {
            if (previous == null) {
                map.remove(key);
            } else {
                map.put(key, previous);
            }
        });
        map.put(key, value);
    }

    private static String key(String... parts) {
        return Currencies.normalize(String.join("|", parts));
    }
}
