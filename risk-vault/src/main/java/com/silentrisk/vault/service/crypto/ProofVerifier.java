package com.silentrisk.vault.service.crypto;

import com.silentrisk.vault.model.ledger.Bytes32;

import java.util.List;

/**
 * Trust boundary to the zero-knowledge / FHE proof system. The vault never interprets proof bytes itself.
 */
public interface ProofVerifier {

    boolean verify(byte[] proof, List<Bytes32> publicInputs);

}
