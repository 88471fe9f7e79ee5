package com.silentrisk.vault.service.vault;

import com.silentrisk.vault.model.ledger.Bytes32;
import com.silentrisk.vault.model.vault.CommitmentRecord;
import com.silentrisk.vault.service.crypto.HomomorphicScoreEvaluator;
import com.silentrisk.vault.service.crypto.ProofVerifier;
import com.silentrisk.vault.service.ledger.LedgerError;
import com.silentrisk.vault.service.ledger.LedgerException;

import java.util.List;

/**
 * Answers "is the stored encrypted score below this threshold?" for a recorded commitment.
 * Holds no state.
 */
public class ThresholdVerifier {

    private final HomomorphicScoreEvaluator evaluator;

    public ThresholdVerifier(HomomorphicScoreEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public boolean isBelowThreshold(ProofVerifier proofVerifier, CommitmentRecord record,
                                    Bytes32 threshold, byte[] thresholdProof) {
        List<Bytes32> publicInputs = List.of(record.getCommitment(), record.getEncryptedScore(), threshold);
        if (!proofVerifier.verify(thresholdProof, publicInputs)) {
            throw LedgerException.of(LedgerError.INVALID_PROOF,
                    "Threshold proof rejected for commitment %s", record.getCommitment());
        }
        return evaluator.isBelow(record.getEncryptedScore(), threshold);
    }

}
