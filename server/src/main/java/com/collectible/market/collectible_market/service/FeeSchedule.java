package com.collectible.market.collectible_market.service;

import com.collectible.market.collectible_market.entity.Money;
import com.collectible.market.collectible_market.error.ErrorCode;
import com.collectible.market.collectible_market.error.MarketException;
import com.collectible.market.collectible_market.event.FeeScheduleUpdated;
import com.collectible.market.collectible_market.execution.SettlementExecutor;
import com.collectible.market.collectible_market.execution.TransactionJournal;
import com.collectible.market.collectible_market.ledger.Currencies;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Marketplace fee in basis points and the account that receives it.
 */
@Slf4j
public class FeeSchedule {

    public static final int MAX_BPS = 10_000;

    private final SystemState systemState;
    private final SettlementExecutor executor;
    private final TransactionJournal journal;
    private volatile int marketplaceFeeBps;
    private volatile String feeRecipient;

    public FeeSchedule(int marketplaceFeeBps, String feeRecipient, SystemState systemState,
            SettlementExecutor executor, TransactionJournal journal) {
        if (marketplaceFeeBps < 0 || marketplaceFeeBps > MAX_BPS) {
            throw new IllegalArgumentException("Marketplace fee must be within [0, 10000] bps: " + marketplaceFeeBps);
        }
        this.marketplaceFeeBps = marketplaceFeeBps;
        this.feeRecipient = Currencies.normalize(feeRecipient);
        this.systemState = systemState;
        this.executor = executor;
        this.journal = journal;
    }

    @Value
    public static class FeeSplit {
        Money fee;
        Money proceeds;
    }

    /**
     * fee = floor(total * bps / 10000); proceeds get the remainder.
     */
    public FeeSplit split(Money total) {
        Money fee = total.bps(marketplaceFeeBps);
        return new FeeSplit(fee, total.subtract(fee));
    }

    public void setMarketplaceFeeBps(String callerAddress, int bps) {
        String caller = Currencies.normalize(callerAddress);
        executor.execute("setMarketplaceFeeBps", () -> {
            systemState.requireAdmin(caller);
            if (bps < 0 || bps > MAX_BPS) {
                throw new MarketException(ErrorCode.INVALID_PARAMS, "Fee bps must be within [0, 10000]: " + bps);
            }
            int previous = marketplaceFeeBps;
            journal.record(() -> marketplaceFeeBps = previous);
            marketplaceFeeBps = bps;
            journal.emit(new FeeScheduleUpdated(caller, bps, feeRecipient));
            log.info("Marketplace fee changed {} -> {} bps", previous, bps);
        });
    }

    public void setFeeRecipient(String callerAddress, String recipientAddress) {
        String caller = Currencies.normalize(callerAddress);
        String recipient = Currencies.normalize(recipientAddress);
        executor.execute("setFeeRecipient", () -> {
            systemState.requireAdmin(caller);
            if (Currencies.isZeroAddress(recipient)) {
                throw new MarketException(ErrorCode.INVALID_PARAMS, "Fee recipient cannot be the zero address");
            }
            String previous = feeRecipient;
            journal.record(() -> feeRecipient = previous);
            feeRecipient = recipient;
            journal.emit(new FeeScheduleUpdated(caller, marketplaceFeeBps, recipient));
            log.info("Fee recipient changed {} -> {}", previous, recipient);
        });
    }

    public int getMarketplaceFeeBps() {
        return marketplaceFeeBps;
    }

    public String getFeeRecipient() {
        return feeRecipient;
    }
}
