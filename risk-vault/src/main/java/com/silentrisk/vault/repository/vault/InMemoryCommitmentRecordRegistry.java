package com.silentrisk.vault.repository.vault;

import com.silentrisk.vault.model.ledger.Bytes32;
import com.silentrisk.vault.model.vault.CommitmentRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Slf4j
public class InMemoryCommitmentRecordRegistry implements CommitmentRecordRegistry {

    private final Map<Bytes32, CommitmentRecord> recordStore = new ConcurrentHashMap<>();

    @Override
    public void save(CommitmentRecord record) {
        log.debug("Save commitment record {}", record.getCommitment());
        recordStore.put(record.getCommitment(), record.toBuilder().build());
    }

    @Override
    public CommitmentRecord load(Bytes32 commitment) {
        CommitmentRecord record = recordStore.get(commitment);
        return record == null ? null : record.toBuilder().build();
    }

    @Override
    public boolean exists(Bytes32 commitment) {
        return recordStore.containsKey(commitment);
    }

    @Override
    public long count() {
        return recordStore.size();
    }

    @Override
    public List<CommitmentRecord> loadAll() {
        return recordStore.values().stream()
                .map(record -> record.toBuilder().build())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public void discard(Bytes32 commitment) {
        recordStore.remove(commitment);
    }

}
