package com.silentrisk.vault.support;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.ledger.Bytes32;
import com.silentrisk.vault.model.vault.RiskSubmission;
import com.silentrisk.vault.repository.ledger.InMemoryLedgerConfigRegistry;
import com.silentrisk.vault.repository.passport.InMemoryPassportTokenRegistry;
import com.silentrisk.vault.repository.passport.PassportTokenRegistry;
import com.silentrisk.vault.repository.vault.InMemoryCommitmentRecordRegistry;
import com.silentrisk.vault.repository.vault.InMemoryNullifierRegistry;
import com.silentrisk.vault.repository.vault.InMemoryUpdaterStateRegistry;
import com.silentrisk.vault.service.DeploymentSettings;
import com.silentrisk.vault.service.VaultDeployment;
import com.silentrisk.vault.service.crypto.CommitmentHasher;
import com.silentrisk.vault.service.crypto.PlaintextScoreEvaluator;

import java.nio.charset.StandardCharsets;

/**
 * A freshly deployed vault and passport registry on a manual clock, with in-memory tables.
 */
public final class VaultFixture {

    public static final Address OWNER = Address.of("0x00000000000000000000000000000000000000a1");
    public static final Address UPDATER = Address.of("0x00000000000000000000000000000000000000b1");
    public static final Address STRANGER = Address.of("0x00000000000000000000000000000000000000c1");
    public static final Address USER = Address.of("0x00000000000000000000000000000000000000d1");
    public static final Address DAO = Address.of("0x00000000000000000000000000000000000000e1");
    public static final Address VAULT_ADDRESS = Address.of("0x0000000000000000000000000000000000001001");
    public static final Address PASSPORT_ADDRESS = Address.of("0x0000000000000000000000000000000000001002");
    public static final Address VERIFIER_ADDRESS = Address.of("0x0000000000000000000000000000000000001003");

    public static final long START_TIME = 1_700_000_000L;
    public static final long START_BLOCK = 20_000L;
    public static final long TEST_BLOCK_HEIGHT = 12_345L;
    public static final long HOUR = 60 * 60;
    public static final long DAY = 24 * HOUR;

    public static final byte[] PROOF = new byte[]{0x0a, 0x0b, 0x0c};

    public final ManualLedgerClock clock = new ManualLedgerClock(START_TIME, START_BLOCK);
    public final ScriptedProofVerifier verifier = new ScriptedProofVerifier();
    public final VaultDeployment deployment;

    public VaultFixture() {
        this(DeploymentSettings.builder());
    }

    public VaultFixture(DeploymentSettings.DeploymentSettingsBuilder settings) {
        this(settings, new InMemoryPassportTokenRegistry());
    }

    public VaultFixture(DeploymentSettings.DeploymentSettingsBuilder settings, PassportTokenRegistry passports) {
        settings.owner(OWNER)
                .vaultAddress(VAULT_ADDRESS)
                .passportAddress(PASSPORT_ADDRESS)
                .verifierAddress(VERIFIER_ADDRESS)
                .authorizedUpdater(UPDATER);
        this.deployment = new VaultDeployment(settings.build(), clock, verifier, new PlaintextScoreEvaluator(),
                new InMemoryCommitmentRecordRegistry(), new InMemoryNullifierRegistry(),
                new InMemoryUpdaterStateRegistry(), passports, new InMemoryLedgerConfigRegistry());
    }

    public static Bytes32 hash(String label) {
        return CommitmentHasher.keccak256(label.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * A well-formed submission for {@code label} with the given plaintext score, minting to {@link #USER}.
     */
    public static RiskSubmission submission(String label, int score) {
        return RiskSubmission.builder()
                .commitment(hash("commitment-" + label))
                .encryptedScore(PlaintextScoreEvaluator.encode(score))
                .scoreProof(PROOF)
                .blockHeight(TEST_BLOCK_HEIGHT)
                .nullifierHash(hash("nullifier-" + label))
                .addressProof(PROOF)
                .recipient(USER)
                .build();
    }

}
