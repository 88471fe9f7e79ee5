package com.silentrisk.vault.support;

import com.silentrisk.vault.model.ledger.Bytes32;
import com.silentrisk.vault.service.crypto.ProofVerifier;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Accepts any non-empty proof except the ones marked as rejected, and records every call.
 */
public class ScriptedProofVerifier implements ProofVerifier {

    private final List<byte[]> rejected = new ArrayList<>();
    private final List<List<Bytes32>> calls = new ArrayList<>();

    @Override
    public boolean verify(byte[] proof, List<Bytes32> publicInputs) {
        calls.add(List.copyOf(publicInputs));
        if (proof == null || proof.length == 0) {
            return false;
        }
        return rejected.stream().noneMatch(r -> Arrays.equals(r, proof));
    }

    public void reject(byte[] proof) {
        rejected.add(proof.clone());
    }

    public List<List<Bytes32>> getCalls() {
        return calls;
    }

    public List<Bytes32> lastCall() {
        return calls.get(calls.size() - 1);
    }

}
