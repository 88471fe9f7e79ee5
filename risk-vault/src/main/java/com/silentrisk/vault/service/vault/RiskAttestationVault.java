package com.silentrisk.vault.service.vault;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.ledger.Bytes32;
import com.silentrisk.vault.model.vault.RiskBand;

/**
 * What the passport registry may ask of the vault it is bound to.
 */
public interface RiskAttestationVault {

    boolean commitmentExists(Bytes32 commitment);

    RiskBand getCommitmentRiskBand(Bytes32 commitment);

    boolean verifyRiskThreshold(Address caller, Bytes32 commitment, Bytes32 threshold, byte[] thresholdProof);

}
