package com.silentrisk.vault.service.vault;

import com.silentrisk.vault.model.event.UpdaterAuthorized;
import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.vault.UpdaterState;
import com.silentrisk.vault.repository.vault.UpdaterStateRegistry;
import com.silentrisk.vault.service.ledger.LedgerError;
import com.silentrisk.vault.service.ledger.LedgerException;
import com.silentrisk.vault.service.ledger.LedgerRuntime;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Contract owner plus the set of authorized updaters. The owner is always an authorized updater.
 */
@Slf4j
public class AccessControl {

    private final LedgerRuntime runtime;
    private final Address contractAddress;
    private final Address owner;
    private final UpdaterStateRegistry updaterStates;

    public AccessControl(LedgerRuntime runtime, Address contractAddress, Address owner,
                         UpdaterStateRegistry updaterStates) {
        if (owner == null || owner.isZero()) {
            throw new IllegalArgumentException("Owner must not be the zero address");
        }
        this.runtime = runtime;
        this.contractAddress = contractAddress;
        this.owner = owner;
        this.updaterStates = updaterStates;
    }

    public Address getOwner() {
        return owner;
    }

    public boolean isOwner(Address account) {
        return owner.equals(account);
    }

    public boolean isAuthorizedUpdater(Address account) {
        if (isOwner(account)) {
            return true;
        }
        UpdaterState state = updaterStates.load(account);
        return state != null && state.isAuthorized();
    }

    public void requireOwner(Address caller) {
        if (!isOwner(caller)) {
            throw LedgerException.of(LedgerError.NOT_AUTHORIZED, "Caller %s is not the owner", caller);
        }
    }

    public void requireAuthorizedUpdater(Address caller) {
        if (!isAuthorizedUpdater(caller)) {
            throw LedgerException.of(LedgerError.NOT_AUTHORIZED, "Caller %s is not an authorized updater", caller);
        }
    }

    /**
     * Grants or withdraws updater rights. The vault applies the owner and pause checks before calling this.
     */
    void setAuthorizedUpdater(Address caller, Address updater, boolean authorized) {
        runtime.execute(caller, "setAuthorizedUpdater", () -> {
            requireOwner(caller);
            if (updater == null || updater.isZero()) {
                throw new LedgerException(LedgerError.ZERO_ADDRESS, "Updater must not be the zero address");
            }
            UpdaterState previous = updaterStates.load(updater);
            UpdaterState base = previous != null ? previous : UpdaterState.fresh(updater);
            updaterStates.save(base.toBuilder().authorized(authorized).build());
            runtime.onRollback(() -> {
                if (previous != null) {
                    updaterStates.save(previous);
                } else {
                    updaterStates.discard(updater);
                }
            });
            runtime.emit(contractAddress, new UpdaterAuthorized(updater, authorized, runtime.now()));
            log.info("Updater {} authorization set to {}", updater, authorized);
        });
    }

    public List<Address> getAuthorizedUpdaters() {
        return updaterStates.loadAll().stream()
                .filter(UpdaterState::isAuthorized)
                .map(UpdaterState::getAccount)
                .collect(Collectors.toList());
    }

}
