package com.silentrisk.vault.service.ledger;

import com.silentrisk.vault.model.event.LedgerEvent;
import com.silentrisk.vault.model.ledger.Address;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * State of the one transaction currently executing: origin, fixed block timestamp,
 * undo journal and the events waiting for commit.
 */
public class TransactionContext {

    private final Address origin;
    private final String operation;
    private final long timestamp;
    private final long blockNumber;
    private final Deque<Runnable> undoJournal = new ArrayDeque<>();
    private final List<PendingEvent> pendingEvents = new ArrayList<>();

    TransactionContext(Address origin, String operation, long timestamp, long blockNumber) {
        this.origin = origin;
        this.operation = operation;
        this.timestamp = timestamp;
        this.blockNumber = blockNumber;
    }

    public Address getOrigin() {
        return origin;
    }

    public String getOperation() {
        return operation;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    void onRollback(Runnable undo) {
        undoJournal.push(undo);
    }

    void emit(Address emitter, LedgerEvent event) {
        pendingEvents.add(new PendingEvent(emitter, event));
    }

    List<PendingEvent> getPendingEvents() {
        return pendingEvents;
    }

    /**
     * Runs the undo actions newest first. Every action is attempted even if an earlier one fails.
     */
    void rollback() {
        RuntimeException failure = null;
        while (!undoJournal.isEmpty()) {
            try {
                undoJournal.pop().run();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        pendingEvents.clear();
        if (failure != null) {
            throw failure;
        }
    }

    static final class PendingEvent {
        private final Address emitter;
        private final LedgerEvent event;

        PendingEvent(Address emitter, LedgerEvent event) {
            this.emitter = emitter;
            this.event = event;
        }

        Address getEmitter() {
            return emitter;
        }

        LedgerEvent getEvent() {
            return event;
        }
    }

}
