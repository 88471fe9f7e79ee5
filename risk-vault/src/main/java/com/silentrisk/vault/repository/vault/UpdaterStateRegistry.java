package com.silentrisk.vault.repository.vault;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.vault.UpdaterState;

import java.util.List;

public interface UpdaterStateRegistry {

    void save(UpdaterState state);

    UpdaterState load(Address account);

    boolean exists(Address account);

    List<UpdaterState> loadAll();

    /**
     * Removes a state first created by a transaction that is being rolled back. Not a ledger operation.
     */
    void discard(Address account);

}
