package com.silentrisk.vault.repository.vault;

import com.silentrisk.vault.model.ledger.Bytes32;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryNullifierRegistry implements NullifierRegistry {

    // nullifier -> ledger time of consumption
    private final Map<Bytes32, Long> nullifierStore = new ConcurrentHashMap<>();

    @Override
    public void consume(Bytes32 nullifier, long timestamp) {
        nullifierStore.put(nullifier, timestamp);
    }

    @Override
    public boolean isUsed(Bytes32 nullifier) {
        return nullifierStore.containsKey(nullifier);
    }

    @Override
    public void discard(Bytes32 nullifier) {
        nullifierStore.remove(nullifier);
    }

}
