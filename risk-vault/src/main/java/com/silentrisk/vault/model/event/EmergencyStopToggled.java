package com.silentrisk.vault.model.event;

import com.silentrisk.vault.model.ledger.Address;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmergencyStopToggled implements LedgerEvent {

    private Address account;
    private boolean paused;

}
