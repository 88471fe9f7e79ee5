package com.silentrisk.vault.model.event;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.ledger.Bytes32;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DAOVerificationPerformed implements LedgerEvent {

    private Bytes32 commitment;
    private Address requester;
    private boolean belowThreshold;
    private long timestamp;

}
