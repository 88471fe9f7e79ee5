package com.silentrisk.vault.model.vault;

import com.silentrisk.vault.model.ledger.Address;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommitmentMetadata {

    private long timestamp;
    private long blockHeight;
    private RiskBand band;
    private Address analyzer;
    private boolean exists;

    public static CommitmentMetadata absent() {
        return new CommitmentMetadata(0, 0, RiskBand.UNKNOWN, Address.ZERO, false);
    }

}
