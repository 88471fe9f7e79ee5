package com.silentrisk.vault.service.vault;

import com.silentrisk.vault.model.event.EmergencyStopToggled;
import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.service.ledger.LedgerConfigStore;
import com.silentrisk.vault.service.ledger.LedgerError;
import com.silentrisk.vault.service.ledger.LedgerException;
import com.silentrisk.vault.service.ledger.LedgerRuntime;
import lombok.extern.slf4j.Slf4j;

/**
 * The pause switch shared by the vault and the passport registry. Reads and threshold queries stay
 * available while paused.
 */
@Slf4j
public class EmergencyStop {

    private final LedgerRuntime runtime;
    private final Address contractAddress;
    private final AccessControl accessControl;
    private final LedgerConfigStore config;

    public EmergencyStop(LedgerRuntime runtime, Address contractAddress, AccessControl accessControl,
                         LedgerConfigStore config) {
        this.runtime = runtime;
        this.contractAddress = contractAddress;
        this.accessControl = accessControl;
        this.config = config;
    }

    public boolean isPaused() {
        return config.current().isPaused();
    }

    public void requireNotPaused() {
        if (isPaused()) {
            throw new LedgerException(LedgerError.CONTRACT_PAUSED, "Contract is paused");
        }
    }

    public void pause(Address caller) {
        toggle(caller, true);
    }

    public void unpause(Address caller) {
        toggle(caller, false);
    }

    private void toggle(Address caller, boolean target) {
        runtime.execute(caller, target ? "pause" : "unpause", () -> {
            accessControl.requireOwner(caller);
            config.update(c -> c.setPaused(target));
            runtime.emit(contractAddress, new EmergencyStopToggled(caller, target));
            log.info("Emergency stop {} by {}", target ? "engaged" : "released", caller);
        });
    }

}
