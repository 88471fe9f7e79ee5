package com.silentrisk.vault.model.event;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.ledger.Bytes32;
import com.silentrisk.vault.model.vault.RiskBand;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RiskAnalysisSubmitted implements LedgerEvent {

    private Bytes32 commitment;
    private Bytes32 nullifierHash;
    private Address analyzer;
    private RiskBand band;
    private long blockHeight;
    private long timestamp;

}
