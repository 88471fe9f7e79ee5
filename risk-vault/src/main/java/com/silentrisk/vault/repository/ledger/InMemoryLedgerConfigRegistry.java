package com.silentrisk.vault.repository.ledger;

import com.silentrisk.vault.model.ledger.LedgerConfig;

public class InMemoryLedgerConfigRegistry implements LedgerConfigRegistry {

    private volatile LedgerConfig stored;

    @Override
    public void save(LedgerConfig config) {
        stored = config.copy();
    }

    @Override
    public LedgerConfig load() {
        LedgerConfig current = stored;
        return current == null ? null : current.copy();
    }

}
