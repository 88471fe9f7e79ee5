package com.silentrisk.vault.repository.vault;

import com.silentrisk.vault.model.ledger.Bytes32;

/**
 * The set of consumed nullifiers. Independent of the commitment table.
 */
public interface NullifierRegistry {

    void consume(Bytes32 nullifier, long timestamp);

    boolean isUsed(Bytes32 nullifier);

    /**
     * Releases a nullifier consumed by a transaction that is being rolled back. Not a ledger operation.
     */
    void discard(Bytes32 nullifier);

}
