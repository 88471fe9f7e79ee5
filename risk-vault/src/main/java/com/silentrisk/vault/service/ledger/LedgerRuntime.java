package com.silentrisk.vault.service.ledger;

import com.silentrisk.vault.model.event.LedgerEvent;
import com.silentrisk.vault.model.ledger.Address;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Executes contract calls as serialized, all-or-nothing transactions.
 * <p>
 * A call made while a transaction is already running on the current thread (a cross-contract call)
 * joins it: its writes share the undo journal and its events are committed or dropped together.
 * Every write to contract state must register an undo action through {@link #onRollback(Runnable)}.
 */
@Slf4j
public class LedgerRuntime {

    private final LedgerClock clock;
    private final EventLog eventLog;
    private final ReentrantLock lock = new ReentrantLock(true);
    private final ThreadLocal<TransactionContext> current = new ThreadLocal<>();

    public LedgerRuntime(LedgerClock clock, EventLog eventLog) {
        this.clock = clock;
        this.eventLog = eventLog;
    }

    public <T> T transact(Address origin, String operation, Supplier<T> body) {
        if (current.get() != null) {
            return body.get();
        }
        lock.lock();
        TransactionContext tx = new TransactionContext(origin, operation, clock.now(), clock.currentBlockNumber());
        current.set(tx);
        try {
            T result = body.get();
            for (TransactionContext.PendingEvent pending : tx.getPendingEvents()) {
                eventLog.append(tx.getTimestamp(), pending.getEmitter(), pending.getEvent());
            }
            return result;
        } catch (RuntimeException e) {
            abort(tx, e);
            throw e;
        } finally {
            current.remove();
            lock.unlock();
        }
    }

    public void execute(Address origin, String operation, Runnable body) {
        transact(origin, operation, () -> {
            body.run();
            return null;
        });
    }

    /**
     * Runs a read-only query against a consistent snapshot: no transaction can commit halfway through it.
     */
    public <T> T view(Supplier<T> query) {
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }

    public void onRollback(Runnable undo) {
        requireTransaction().onRollback(undo);
    }

    public void emit(Address emitter, LedgerEvent event) {
        requireTransaction().emit(emitter, event);
    }

    /**
     * Ledger time: the block timestamp inside a transaction, the clock's time otherwise.
     */
    public long now() {
        TransactionContext tx = current.get();
        return tx != null ? tx.getTimestamp() : clock.now();
    }

    public long currentBlockNumber() {
        TransactionContext tx = current.get();
        return tx != null ? tx.getBlockNumber() : clock.currentBlockNumber();
    }

    public Address origin() {
        return requireTransaction().getOrigin();
    }

    public boolean inTransaction() {
        return current.get() != null;
    }

    private TransactionContext requireTransaction() {
        TransactionContext tx = current.get();
        if (tx == null) {
            throw new IllegalStateException("No ledger transaction is active on this thread");
        }
        return tx;
    }

    private void abort(TransactionContext tx, RuntimeException cause) {
        if (cause instanceof LedgerException) {
            log.warn("Transaction {} from {} rejected with {}: {}",
                    tx.getOperation(), tx.getOrigin(), ((LedgerException) cause).getError(), cause.getMessage());
        } else {
            log.error("Transaction {} from {} failed", tx.getOperation(), tx.getOrigin(), cause);
        }
        try {
            tx.rollback();
        } catch (RuntimeException undoFailure) {
            log.error("Rollback of {} did not complete", tx.getOperation(), undoFailure);
            cause.addSuppressed(undoFailure);
        }
    }

}
