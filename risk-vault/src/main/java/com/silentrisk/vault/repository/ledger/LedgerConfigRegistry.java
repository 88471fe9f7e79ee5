package com.silentrisk.vault.repository.ledger;

import com.silentrisk.vault.model.ledger.LedgerConfig;

public interface LedgerConfigRegistry {

    void save(LedgerConfig config);

    /**
     * @return the stored configuration, or {@code null} before the first deployment
     */
    LedgerConfig load();

}
