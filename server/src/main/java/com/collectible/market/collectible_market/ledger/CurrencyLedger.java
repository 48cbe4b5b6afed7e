package com.collectible.market.collectible_market.ledger;

import com.collectible.market.collectible_market.entity.Money;

/**
 * Balances of the native currency and of fungible payment tokens.
 */
public interface CurrencyLedger {

    Money balanceOf(String account, String currency);

    Money allowance(String owner, String spender, String currency);

    void approve(String owner, String spender, String currency, Money amount);

    /**
     * Credit new funds to an account (faucet / bridge-in).
     */
    void deposit(String account, String currency, Money amount);

    /**
     * Fails INSUFFICIENT_BALANCE, or TRANSFER_REJECTED if the recipient refuses funds.
     */
    void transfer(String from, String to, String currency, Money amount);

    /**
     * Spend an allowance. Fails INSUFFICIENT_ALLOWANCE before any balance check.
     */
    void transferFrom(String spender, String from, String to, String currency, Money amount);
}
