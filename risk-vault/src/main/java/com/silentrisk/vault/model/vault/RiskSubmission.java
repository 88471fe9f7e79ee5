package com.silentrisk.vault.model.vault;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.ledger.Bytes32;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One analysis as delivered by the off-chain updater pipeline.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RiskSubmission {

    private Bytes32 commitment;
    private Bytes32 encryptedScore;
    private byte[] scoreProof;
    private long blockHeight;
    private Bytes32 nullifierHash;
    private byte[] addressProof;
    private Address recipient;

}
