package com.silentrisk.vault.repository.vault;

import com.silentrisk.vault.model.ledger.Bytes32;
import com.silentrisk.vault.repository.JsonFileStorage;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;

public class JsonFileNullifierRegistry implements NullifierRegistry {

    private final JsonFileStorage<ConsumedNullifier> storage;

    public JsonFileNullifierRegistry(String path) throws IOException {
        this.storage = new JsonFileStorage<>(path, "nullifiers", ConsumedNullifier.class);
    }

    @Override
    public void consume(Bytes32 nullifier, long timestamp) {
        storage.write(nullifier.toHex(), new ConsumedNullifier(nullifier, timestamp));
    }

    @Override
    public boolean isUsed(Bytes32 nullifier) {
        return storage.exists(nullifier.toHex());
    }

    @Override
    public void discard(Bytes32 nullifier) {
        storage.delete(nullifier.toHex());
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConsumedNullifier {
        private Bytes32 nullifier;
        private long consumedAt;
    }

}
