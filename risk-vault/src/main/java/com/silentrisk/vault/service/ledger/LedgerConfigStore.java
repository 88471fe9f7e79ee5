package com.silentrisk.vault.service.ledger;

import com.silentrisk.vault.model.ledger.LedgerConfig;
import com.silentrisk.vault.repository.ledger.LedgerConfigRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Consumer;

/**
 * The configuration shared by the contract pair. Changes are written through to the registry
 * inside the running transaction and restored if it rolls back.
 */
@Slf4j
public class LedgerConfigStore {

    private final LedgerRuntime runtime;
    private final LedgerConfigRegistry registry;
    private volatile LedgerConfig current;

    /**
     * Resumes from the stored configuration, or stores {@code initial} when there is none yet.
     */
    public LedgerConfigStore(LedgerRuntime runtime, LedgerConfigRegistry registry, LedgerConfig initial) {
        this.runtime = runtime;
        this.registry = registry;
        LedgerConfig stored = registry.load();
        if (stored == null) {
            registry.save(initial);
            stored = initial;
            log.info("Stored initial ledger configuration");
        } else {
            log.info("Resuming with stored ledger configuration (paused={})", stored.isPaused());
        }
        this.current = stored.copy();
    }

    /**
     * The configuration in effect. Callers must treat it as read-only.
     */
    public LedgerConfig current() {
        return current;
    }

    /**
     * Applies {@code change} to a copy of the configuration and stores it. Must run inside a transaction.
     *
     * @return the configuration before the change
     */
    public LedgerConfig update(Consumer<LedgerConfig> change) {
        LedgerConfig previous = current;
        LedgerConfig next = previous.copy();
        change.accept(next);
        runtime.onRollback(() -> {
            registry.save(previous);
            current = previous;
        });
        registry.save(next);
        current = next;
        return previous;
    }

}
