package com.silentrisk.vault.service.crypto;

import com.silentrisk.vault.model.ledger.Bytes32;
import com.silentrisk.vault.model.vault.BandThresholds;
import com.silentrisk.vault.model.vault.RiskBand;
import com.silentrisk.vault.service.ledger.LedgerError;
import com.silentrisk.vault.service.ledger.LedgerException;

import java.math.BigInteger;

/**
 * Development stand-in for the FHE backend: a handle is the big-endian score itself.
 * Offers no privacy and must not be deployed against real analyses.
 */
public class PlaintextScoreEvaluator implements HomomorphicScoreEvaluator {

    private static final BigInteger MAX = BigInteger.valueOf(BandThresholds.MAX_RISK_SCORE);

    @Override
    public RiskBand classify(Bytes32 encryptedScore, BandThresholds thresholds) {
        return thresholds.classify(decode(encryptedScore));
    }

    @Override
    public boolean isBelow(Bytes32 encryptedScore, Bytes32 encryptedThreshold) {
        return encryptedScore.toUnsigned().compareTo(encryptedThreshold.toUnsigned()) < 0;
    }

    public static Bytes32 encode(int score) {
        return Bytes32.fromUnsigned(score);
    }

    private int decode(Bytes32 handle) {
        BigInteger score = handle.toUnsigned();
        if (score.compareTo(MAX) > 0) {
            throw LedgerException.of(LedgerError.SCORE_EXCEEDS_MAXIMUM,
                    "Score exceeds maximum of %d", BandThresholds.MAX_RISK_SCORE);
        }
        return score.intValue();
    }

}
