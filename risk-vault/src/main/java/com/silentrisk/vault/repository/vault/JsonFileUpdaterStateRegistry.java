package com.silentrisk.vault.repository.vault;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.vault.UpdaterState;
import com.silentrisk.vault.repository.JsonFileStorage;

import java.io.IOException;
import java.util.List;

public class JsonFileUpdaterStateRegistry implements UpdaterStateRegistry {

    private final JsonFileStorage<UpdaterState> storage;

    public JsonFileUpdaterStateRegistry(String path) throws IOException {
        this.storage = new JsonFileStorage<>(path, "updaters", UpdaterState.class);
    }

    @Override
    public void save(UpdaterState state) {
        storage.write(state.getAccount().toHex(), state);
    }

    @Override
    public UpdaterState load(Address account) {
        return storage.read(account.toHex());
    }

    @Override
    public boolean exists(Address account) {
        return storage.exists(account.toHex());
    }

    @Override
    public List<UpdaterState> loadAll() {
        return storage.readAll();
    }

    @Override
    public void discard(Address account) {
        storage.delete(account.toHex());
    }

}
