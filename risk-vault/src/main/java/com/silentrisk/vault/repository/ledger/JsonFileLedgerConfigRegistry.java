package com.silentrisk.vault.repository.ledger;

import com.silentrisk.vault.model.ledger.LedgerConfig;
import com.silentrisk.vault.repository.JsonFileStorage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

@Slf4j
public class JsonFileLedgerConfigRegistry implements LedgerConfigRegistry {

    private static final String KEY = "ledger";

    private final JsonFileStorage<LedgerConfig> storage;

    public JsonFileLedgerConfigRegistry(String path) throws IOException {
        this.storage = new JsonFileStorage<>(path, "config", LedgerConfig.class);
    }

    @Override
    public void save(LedgerConfig config) {
        log.debug("Save ledger configuration");
        storage.write(KEY, config);
    }

    @Override
    public LedgerConfig load() {
        return storage.read(KEY);
    }

}
