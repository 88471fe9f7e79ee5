package com.silentrisk.vault.repository.vault;

import com.silentrisk.vault.model.ledger.Bytes32;
import com.silentrisk.vault.model.vault.CommitmentRecord;
import com.silentrisk.vault.repository.JsonFileStorage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;

@Slf4j
public class JsonFileCommitmentRecordRegistry implements CommitmentRecordRegistry {

    private final JsonFileStorage<CommitmentRecord> storage;

    public JsonFileCommitmentRecordRegistry(String path) throws IOException {
        this.storage = new JsonFileStorage<>(path, "commitments", CommitmentRecord.class);
    }

    @Override
    public void save(CommitmentRecord record) {
        log.debug("Save commitment record {}", record.getCommitment());
        storage.write(record.getCommitment().toHex(), record);
    }

    @Override
    public CommitmentRecord load(Bytes32 commitment) {
        return storage.read(commitment.toHex());
    }

    @Override
    public boolean exists(Bytes32 commitment) {
        return storage.exists(commitment.toHex());
    }

    @Override
    public long count() {
        return storage.count();
    }

    @Override
    public List<CommitmentRecord> loadAll() {
        return storage.readAll();
    }

    @Override
    public void discard(Bytes32 commitment) {
        storage.delete(commitment.toHex());
    }

}
