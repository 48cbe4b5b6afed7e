package com.collectible.market.collectible_market.service;

import com.collectible.market.collectible_market.error.ErrorCode;
import com.collectible.market.collectible_market.error.MarketException;
import com.collectible.market.collectible_market.event.PauseStateChanged;
import com.collectible.market.collectible_market.execution.SettlementExecutor;
import com.collectible.market.collectible_market.execution.TransactionJournal;
import com.collectible.market.collectible_market.ledger.Currencies;

import lombok.extern.slf4j.Slf4j;

/**
 * Global admin identity and pause switch, shared by every engine.
 *
 * Pause freezes the entry points that take money in (mint, buy, bid).
 * Cancellation, collection and withdrawal stay open so funds and assets can
 * always leave escrow.
 */
@Slf4j
public class SystemState {

    private final String admin;
    private final SettlementExecutor executor;
    private final TransactionJournal journal;
    private volatile boolean paused;

    public SystemState(String admin, SettlementExecutor executor, TransactionJournal journal) {
        this.admin = Currencies.normalize(admin);
        this.executor = executor;
        this.journal = journal;
    }

    public void pause(String caller) {
        setPaused(Currencies.normalize(caller), true);
    }

    public void unpause(String caller) {
        setPaused(Currencies.normalize(caller), false);
    }

    public boolean isPaused() {
        return paused;
    }

    public String getAdmin() {
        return admin;
    }

    public boolean isAdmin(String caller) {
        return admin.equals(Currencies.normalize(caller));
    }

    public void requireAdmin(String caller) {
        if (!isAdmin(caller)) {
            throw new MarketException(ErrorCode.NOT_ADMIN, caller + " is not the admin");
        }
    }

    public void requireNotPaused() {
        if (paused) {
            throw new MarketException(ErrorCode.PAUSED);
        }
    }

    private void setPaused(String caller, boolean value) {
        executor.execute(value ? "pause" : "unpause", () -> {
            requireAdmin(caller);
            boolean previous = paused;
            journal.record(() -> paused = previous);
            paused = value;
            journal.emit(new PauseStateChanged(caller, value));
            log.info("Market {} by {}", value ? "paused" : "unpaused", caller);
        });
    }
}
