package com.silentrisk.vault.repository.passport;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.ledger.Bytes32;
import com.silentrisk.vault.model.passport.Passport;
import com.silentrisk.vault.repository.JsonFileStorage;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
public class JsonFilePassportTokenRegistry implements PassportTokenRegistry {

    private final JsonFileStorage<Passport> tokens;
    private final JsonFileStorage<CommitmentIndexEntry> commitmentIndex;
    private final JsonFileStorage<OperatorApprovals> operatorApprovals;

    public JsonFilePassportTokenRegistry(String path) throws IOException {
        this.tokens = new JsonFileStorage<>(path, "passports", Passport.class);
        this.commitmentIndex = new JsonFileStorage<>(path, "passport-commitments", CommitmentIndexEntry.class);
        this.operatorApprovals = new JsonFileStorage<>(path, "passport-operators", OperatorApprovals.class);
    }

    @Override
    public void save(Passport passport) {
        log.debug("Save passport {}", passport.getTokenId());
        tokens.write(Long.toString(passport.getTokenId()), passport);
        commitmentIndex.write(passport.getCommitment().toHex(),
                new CommitmentIndexEntry(passport.getCommitment(), passport.getTokenId()));
    }

    @Override
    public Passport load(long tokenId) {
        return tokens.read(Long.toString(tokenId));
    }

    @Override
    public boolean exists(long tokenId) {
        return tokens.exists(Long.toString(tokenId));
    }

    @Override
    public Optional<Long> findByCommitment(Bytes32 commitment) {
        CommitmentIndexEntry entry = commitmentIndex.read(commitment.toHex());
        return entry == null ? Optional.empty() : Optional.of(entry.getTokenId());
    }

    @Override
    public long count() {
        return tokens.count();
    }

    @Override
    public long countOwnedBy(Address owner) {
        return tokens.readAll().stream()
                .filter(p -> owner.equals(p.getOwner()))
                .count();
    }

    @Override
    public void setOperatorApproval(Address holder, Address operator, boolean approved) {
        OperatorApprovals entry = operatorApprovals.read(holder.toHex());
        if (entry == null) {
            entry = new OperatorApprovals(holder, new ArrayList<>());
        }
        entry.getOperators().remove(operator);
        if (approved) {
            entry.getOperators().add(operator);
        }
        operatorApprovals.write(holder.toHex(), entry);
    }

    @Override
    public boolean isOperatorApproved(Address holder, Address operator) {
        OperatorApprovals entry = operatorApprovals.read(holder.toHex());
        return entry != null && entry.getOperators().contains(operator);
    }

    @Override
    public void discard(long tokenId) {
        Passport removed = tokens.read(Long.toString(tokenId));
        if (removed != null) {
            commitmentIndex.delete(removed.getCommitment().toHex());
            tokens.delete(Long.toString(tokenId));
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CommitmentIndexEntry {
        private Bytes32 commitment;
        private long tokenId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OperatorApprovals {
        private Address holder;
        private List<Address> operators;
    }

}
