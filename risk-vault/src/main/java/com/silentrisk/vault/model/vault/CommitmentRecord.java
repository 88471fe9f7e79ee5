package com.silentrisk.vault.model.vault;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.ledger.Bytes32;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Attestation stored for a commitment. Written once and never modified.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CommitmentRecord {

    private Bytes32 commitment;

    // Opaque handle of the FHE ciphertext; consulted only by threshold queries
    private Bytes32 encryptedScore;

    private long timestamp;
    private long blockHeight;
    private RiskBand band;
    private Address analyzer;

}
