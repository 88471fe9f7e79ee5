package com.silentrisk.vault.service.crypto;

import com.silentrisk.vault.model.ledger.Bytes32;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Development verifier that only checks the shape of a proof: long enough, and bound to
 * a non-zero commitment (the first public input). Accepts anything well formed.
 */
@Slf4j
public class StructuralProofVerifier implements ProofVerifier {

    public static final int DEFAULT_MIN_PROOF_LENGTH = 64;

    private final int minProofLength;

    public StructuralProofVerifier(int minProofLength) {
        if (minProofLength <= 0) {
            throw new IllegalArgumentException("Minimum proof length must be positive: " + minProofLength);
        }
        this.minProofLength = minProofLength;
    }

    @Override
    public boolean verify(byte[] proof, List<Bytes32> publicInputs) {
        if (proof == null || proof.length < minProofLength) {
            log.debug("Proof rejected: {} bytes, {} required", proof == null ? 0 : proof.length, minProofLength);
            return false;
        }
        if (publicInputs.isEmpty() || publicInputs.get(0).isZero()) {
            log.debug("Proof rejected: missing or zero commitment input");
            return false;
        }
        return true;
    }

}
