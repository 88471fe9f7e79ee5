package com.silentrisk.vault.service.ledger;

import com.silentrisk.vault.model.ledger.Address;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Deployed contracts by address. Contracts hold only the addresses of their counterparts
 * and resolve them here on every cross-contract call.
 */
@Slf4j
public class ContractDirectory {

    private final Map<Address, Object> contracts = new ConcurrentHashMap<>();

    public void deploy(Address address, Object contract) {
        if (address == null || address.isZero()) {
            throw new IllegalArgumentException("Cannot deploy a contract at the zero address");
        }
        Object existing = contracts.putIfAbsent(address, contract);
        if (existing != null) {
            throw new IllegalStateException("A contract is already deployed at " + address);
        }
        log.info("Deployed {} at {}", contract.getClass().getSimpleName(), address);
    }

    public <T> Optional<T> lookup(Address address, Class<T> type) {
        if (address == null) {
            return Optional.empty();
        }
        Object contract = contracts.get(address);
        return type.isInstance(contract) ? Optional.of(type.cast(contract)) : Optional.empty();
    }

}
