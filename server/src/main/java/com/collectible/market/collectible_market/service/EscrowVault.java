package com.collectible.market.collectible_market.service;

import com.collectible.market.collectible_market.entity.Money;
import com.collectible.market.collectible_market.ledger.Currencies;
import com.collectible.market.collectible_market.ledger.CurrencyLedger;

/**
 * Custody account for funds between payment and settlement.
 *
 * Native payments are taken from the caller's balance directly. Token payments
 * need an allowance from the payer to the escrow account.
 */
public class EscrowVault {

    private final CurrencyLedger currencyLedger;
    private final String escrowAddress;

    public EscrowVault(CurrencyLedger currencyLedger, String escrowAddress) {
        this.currencyLedger = currencyLedger;
        this.escrowAddress = Currencies.normalize(escrowAddress);
    }

    public void pull(String payer, String currency, Money amount) {
        if (amount.isZero()) {
            return;
        }
        if (Currencies.isNative(currency)) {
            currencyLedger.transfer(payer, escrowAddress, currency, amount);
        } else {
            currencyLedger.transferFrom(escrowAddress, payer, escrowAddress, currency, amount);
        }
    }

    /**
     * Send escrowed funds out. Fails TRANSFER_REJECTED if the recipient refuses them.
     */
    public void push(String to, String currency, Money amount) {
        if (amount.isZero()) {
            return;
        }
        currencyLedger.transfer(escrowAddress, to, currency, amount);
    }

    public Money heldIn(String currency) {
        return currencyLedger.balanceOf(escrowAddress, currency);
    }

    public String getEscrowAddress() {
        return escrowAddress;
    }
}
