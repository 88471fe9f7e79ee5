package com.silentrisk.vault.service.crypto;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.ledger.Bytes32;
import org.bouncycastle.crypto.digests.KeccakDigest;

import java.security.SecureRandom;

/**
 * Packed Keccak-256 encodings used by the browser and the worker to derive vault inputs.
 * The vault itself never sees the wallet or the secret.
 */
public final class CommitmentHasher {

    private static final SecureRandom RANDOM = new SecureRandom();

    private CommitmentHasher() {
    }

    /**
     * keccak256(wallet (20 bytes) || secret (32 bytes))
     */
    public static Bytes32 commitment(Address wallet, Bytes32 secret) {
        return keccak256(wallet.toBytes(), secret.toBytes());
    }

    /**
     * keccak256(secret || commitment)
     */
    public static Bytes32 nullifier(Bytes32 secret, Bytes32 commitment) {
        return keccak256(secret.toBytes(), commitment.toBytes());
    }

    public static Bytes32 randomSecret() {
        byte[] secret = new byte[Bytes32.LENGTH];
        RANDOM.nextBytes(secret);
        return Bytes32.wrap(secret);
    }

    public static Bytes32 keccak256(byte[]... parts) {
        KeccakDigest digest = new KeccakDigest(256);
        for (byte[] part : parts) {
            digest.update(part, 0, part.length);
        }
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return Bytes32.wrap(out);
    }

}
