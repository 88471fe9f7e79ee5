package com.silentrisk.vault.repository.passport;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.ledger.Bytes32;
import com.silentrisk.vault.model.passport.Passport;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemoryPassportTokenRegistry implements PassportTokenRegistry {

    private final Map<Long, Passport> tokenStore = new ConcurrentHashMap<>();
    private final Map<Bytes32, Long> commitmentIndex = new ConcurrentHashMap<>();
    private final Map<Address, Set<Address>> operatorApprovals = new ConcurrentHashMap<>();

    @Override
    public void save(Passport passport) {
        log.debug("Save passport {}", passport.getTokenId());
        tokenStore.put(passport.getTokenId(), passport.toBuilder().build());
        commitmentIndex.put(passport.getCommitment(), passport.getTokenId());
    }

    @Override
    public Passport load(long tokenId) {
        Passport passport = tokenStore.get(tokenId);
        return passport == null ? null : passport.toBuilder().build();
    }

    @Override
    public boolean exists(long tokenId) {
        return tokenStore.containsKey(tokenId);
    }

    @Override
    public Optional<Long> findByCommitment(Bytes32 commitment) {
        return Optional.ofNullable(commitmentIndex.get(commitment));
    }

    @Override
    public long count() {
        return tokenStore.size();
    }

    @Override
    public long countOwnedBy(Address owner) {
        return tokenStore.values().stream()
                .filter(p -> owner.equals(p.getOwner()))
                .count();
    }

    @Override
    public void setOperatorApproval(Address holder, Address operator, boolean approved) {
        Set<Address> operators = operatorApprovals.computeIfAbsent(holder, k -> ConcurrentHashMap.newKeySet());
        if (approved) {
            operators.add(operator);
        } else {
            operators.remove(operator);
        }
    }

    @Override
    public boolean isOperatorApproved(Address holder, Address operator) {
        Set<Address> operators = operatorApprovals.get(holder);
        return operators != null && operators.contains(operator);
    }

    @Override
    public void discard(long tokenId) {
        Passport removed = tokenStore.remove(tokenId);
        if (removed != null) {
            commitmentIndex.remove(removed.getCommitment());
        }
    }

}
