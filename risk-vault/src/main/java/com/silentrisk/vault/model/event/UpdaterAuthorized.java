package com.silentrisk.vault.model.event;

import com.silentrisk.vault.model.ledger.Address;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdaterAuthorized implements LedgerEvent {

    private Address updater;
    private boolean authorized;
    private long timestamp;

}
