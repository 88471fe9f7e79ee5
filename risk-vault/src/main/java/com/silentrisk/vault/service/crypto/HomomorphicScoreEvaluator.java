package com.silentrisk.vault.service.crypto;

import com.silentrisk.vault.model.ledger.Bytes32;
import com.silentrisk.vault.model.vault.BandThresholds;
import com.silentrisk.vault.model.vault.RiskBand;

/**
 * Operations over encrypted score handles. Implementations compare ciphertexts against
 * cut points and thresholds without revealing the score to the ledger.
 */
public interface HomomorphicScoreEvaluator {

    /**
     * Places the encrypted score in the deployment's band table.
     *
     * @throws com.silentrisk.vault.service.ledger.LedgerException with {@code SCORE_EXCEEDS_MAXIMUM}
     *         if the score lies above the scale
     */
    RiskBand classify(Bytes32 encryptedScore, BandThresholds thresholds);

    /**
     * @return true if the encrypted score is strictly below the encrypted threshold
     */
    boolean isBelow(Bytes32 encryptedScore, Bytes32 encryptedThreshold);

}
