package com.silentrisk.vault.repository.vault;

import com.silentrisk.vault.model.ledger.Bytes32;
import com.silentrisk.vault.model.vault.CommitmentRecord;

import java.util.List;

/**
 * Append-only table of commitment attestations, keyed by commitment hash.
 */
public interface CommitmentRecordRegistry {

    void save(CommitmentRecord record);

    CommitmentRecord load(Bytes32 commitment);

    boolean exists(Bytes32 commitment);

    long count();

    List<CommitmentRecord> loadAll();

    /**
     * Removes a record written by a transaction that is being rolled back. Not a ledger operation.
     */
    void discard(Bytes32 commitment);

}
