package com.collectible.market.collectible_market.execution;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.collectible.market.collectible_market.event.MarketEvent;

import lombok.extern.slf4j.Slf4j;

/**
 * Undo log for the settlement operation currently running on the executor.
 *
 * Every mutation of a record, counter, ledger or balance registers the action
 * that reverses it. On failure the actions run in reverse order, restoring the
 * state observed when the operation began. Events queued here are released only
 * on commit.
 *
 * Mutations made while no operation is open (fixtures, bootstrap) are not journaled.
 */
@Slf4j
public class TransactionJournal {

    private final Deque<Runnable> undoActions = new ArrayDeque<>();
    private final List<MarketEvent> pendingEvents = new ArrayList<>();
    private volatile boolean open;

    void begin() {
        if (open) {
            throw new IllegalStateException("A settlement operation is already open");
        }
        open = true;
    }

    public boolean isOpen() {
        return open;
    }

    /**
     * Register the action that reverses a mutation just applied.
     */
    public void record(Runnable undo) {
        if (open) {
            undoActions.push(undo);
        }
    }

    /**
     * Queue an event for publication once the operation commits.
     */
    public void emit(MarketEvent event) {
        if (!open) {
            throw new IllegalStateException("Events can only be emitted inside a settlement operation");
        }
        pendingEvents.add(event);
    }

    List<MarketEvent> commit() {
        List<MarketEvent> events = new ArrayList<>(pendingEvents);
        undoActions.clear();
        pendingEvents.clear();
        open = false;
        return events;
    }

    void rollback() {
        int undone = 0;
        while (!undoActions.isEmpty()) {
            Runnable undo = undoActions.pop();
            try {
                undo.run();
                undone++;
            } catch (RuntimeException e) {
                log.error("Undo action failed during rollback, state may be inconsistent", e);
            }
        }
        pendingEvents.clear();
        open = false;
        log.debug("Rolled back {} mutations", undone);
    }
}
