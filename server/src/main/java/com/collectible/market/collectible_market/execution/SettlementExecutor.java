package com.collectible.market.collectible_market.execution;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Supplier;

import org.springframework.context.ApplicationEventPublisher;

import com.collectible.market.collectible_market.error.MarketException;
import com.collectible.market.collectible_market.event.MarketEvent;

import lombok.extern.slf4j.Slf4j;

/**
 * Serialises every settlement operation onto one thread.
 *
 * Each operation runs to completion before the next starts, so callers racing
 * for the same auction or listing observe a strict order and never see a torn
 * record. An operation either commits all of its mutations or none of them:
 * on any exception the {@link TransactionJournal} is rolled back and the
 * exception is rethrown to the caller unchanged.
 *
 * Events are published on the caller's thread after commit, so listeners may
 * call back into the engines. Listener failures are logged, not rethrown.
 */
@Slf4j
public class SettlementExecutor {

    private final TransactionJournal journal;
    private final ApplicationEventPublisher eventPublisher;
    private final ExecutorService executor;
    private volatile Thread worker;

    public SettlementExecutor(TransactionJournal journal, ApplicationEventPublisher eventPublisher) {
        this.journal = journal;
        this.eventPublisher = eventPublisher;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "settlement-executor");
            thread.setDaemon(true);
            worker = thread;
            return thread;
        });
    }

    /**
     * Run a state-changing operation atomically and return its result.
     */
    public <T> T execute(String operation, Supplier<T> work) {
        if (Thread.currentThread() == worker) {
            // Already inside an operation: join it.
            return work.get();
        }
        Outcome<T> outcome = await(executor.submit(() -> runAtomically(operation, work)));
        publish(operation, outcome.events);
        return outcome.result;
    }

    public void execute(String operation, Runnable work) {
        execute(operation, () -> {
            work.run();
            return null;
        });
    }

    /**
     * Run a read against committed state.
     */
    public <T> T read(Supplier<T> query) {
        if (Thread.currentThread() == worker) {
            return query.get();
        }
        return await(executor.submit(query::get));
    }

    public void shutdown() {
        executor.shutdown();
    }

    /**
     * The operation has already committed, so a failing listener is logged and
     * never reaches the caller.
     */
    private void publish(String operation, List<MarketEvent> events) {
        for (MarketEvent event : events) {
            try {
                eventPublisher.publishEvent(event);
            } catch (RuntimeException e) {
                log.error("Event listener failed after commit: op={}, event={}", operation, event, e);
            }
        }
    }

    private <T> Outcome<T> runAtomically(String operation, Supplier<T> work) {
        journal.begin();
        try {
            T result = work.get();
            List<MarketEvent> events = journal.commit();
            return new Outcome<>(result, events);
        } catch (MarketException e) {
            journal.rollback();
            log.warn("Settlement operation rejected: op={}, code={}, reason={}",
                    operation, e.getCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            journal.rollback();
            log.error("Settlement operation failed: op={}, error={}", operation, e.getMessage(), e);
            throw e;
        }
    }

    private static <V> V await(Future<V> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for settlement", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Settlement operation failed", cause);
        }
    }

    private static final class Outcome<T> {
        private final T result;
        private final List<MarketEvent> events;

        private Outcome(T result, List<MarketEvent> events) {
            this.result = result;
            this.events = events;
        }
    }
}
