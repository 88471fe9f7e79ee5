package com.silentrisk.vault.repository;

import com.silentrisk.vault.model.ledger.LedgerConfig;
import com.silentrisk.vault.model.passport.Passport;
import com.silentrisk.vault.model.vault.CommitmentRecord;
import com.silentrisk.vault.model.vault.RiskBand;
import com.silentrisk.vault.model.vault.RiskSubmission;
import com.silentrisk.vault.model.vault.UpdaterState;
import com.silentrisk.vault.model.vault.ValidityStatus;
import com.silentrisk.vault.model.vault.VaultInfo;
import com.silentrisk.vault.repository.ledger.JsonFileLedgerConfigRegistry;
import com.silentrisk.vault.repository.passport.JsonFilePassportTokenRegistry;
import com.silentrisk.vault.repository.vault.JsonFileCommitmentRecordRegistry;
import com.silentrisk.vault.repository.vault.JsonFileNullifierRegistry;
import com.silentrisk.vault.repository.vault.JsonFileUpdaterStateRegistry;
import com.silentrisk.vault.service.DeploymentSettings;
import com.silentrisk.vault.service.VaultDeployment;
import com.silentrisk.vault.service.crypto.PlaintextScoreEvaluator;
import com.silentrisk.vault.service.ledger.LedgerError;
import com.silentrisk.vault.service.vault.CommitmentLedger;
import com.silentrisk.vault.support.ManualLedgerClock;
import com.silentrisk.vault.support.ScriptedProofVerifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static com.silentrisk.vault.support.LedgerAssertions.assertRejected;
import static com.silentrisk.vault.support.VaultFixture.*;
import static org.assertj.core.api.Assertions.assertThat;

class JsonFileRegistriesTest {

    @TempDir
    Path storage;

    private String path() {
        return storage.toString();
    }

    @Test
    void commitmentRecordsSurviveReopening() throws IOException {
        CommitmentRecord record = CommitmentRecord.builder()
                .commitment(hash("commitment"))
                .encryptedScore(PlaintextScoreEvaluator.encode(4200))
                .timestamp(START_TIME)
                .blockHeight(TEST_BLOCK_HEIGHT)
                .band(RiskBand.MEDIUM)
                .analyzer(UPDATER)
                .build();
        new JsonFileCommitmentRecordRegistry(path()).save(record);

        JsonFileCommitmentRecordRegistry reopened = new JsonFileCommitmentRecordRegistry(path());

        assertThat(reopened.exists(record.getCommitment())).isTrue();
        assertThat(reopened.load(record.getCommitment())).isEqualTo(record);
        assertThat(reopened.count()).isEqualTo(1);
        assertThat(reopened.loadAll()).containsExactly(record);

        reopened.discard(record.getCommitment());
        assertThat(reopened.load(record.getCommitment())).isNull();
        assertThat(reopened.count()).isZero();
    }

    @Test
    void nullifiersAndUpdaterStatesArePersisted() throws IOException {
        new JsonFileNullifierRegistry(path()).consume(hash("nullifier"), START_TIME);
        UpdaterState state = UpdaterState.fresh(UPDATER).toBuilder()
                .authorized(true)
                .lastSubmissionTime(START_TIME)
                .build();
        new JsonFileUpdaterStateRegistry(path()).save(state);

        assertThat(new JsonFileNullifierRegistry(path()).isUsed(hash("nullifier"))).isTrue();
        assertThat(new JsonFileNullifierRegistry(path()).isUsed(hash("other"))).isFalse();
        JsonFileUpdaterStateRegistry updaters = new JsonFileUpdaterStateRegistry(path());
        assertThat(updaters.load(UPDATER)).isEqualTo(state);
        assertThat(updaters.exists(STRANGER)).isFalse();
    }

    @Test
    void passportIndexFollowsDiscard() throws IOException {
        JsonFilePassportTokenRegistry passports = new JsonFilePassportTokenRegistry(path());
        Passport passport = Passport.builder()
                .tokenId(0)
                .owner(USER)
                .commitment(hash("commitment"))
                .mintTime(START_TIME)
                .expiry(START_TIME + 30 * DAY)
                .build();
        passports.save(passport);

        assertThat(passports.load(0)).isEqualTo(passport);
        assertThat(passports.findByCommitment(passport.getCommitment())).contains(0L);
        assertThat(passports.countOwnedBy(USER)).isEqualTo(1);

        passports.discard(0);
        assertThat(passports.exists(0)).isFalse();
        assertThat(passports.findByCommitment(passport.getCommitment())).isEmpty();
    }

    @Test
    void ledgerStateOnDiskOutlivesTheDeployment() throws IOException {
        RiskSubmission first = submission("alice", 2500);
        VaultDeployment deployment = deploy();
        deployment.getVault().submitRiskAnalysis(UPDATER, first);

        VaultDeployment restarted = deploy();

        assertThat(restarted.getVault().getRiskBand(first.getCommitment())).isEqualTo(RiskBand.LOW);
        assertThat(restarted.getVault().isNullifierUsed(first.getNullifierHash())).isTrue();
        assertThat(restarted.getPassportRegistry().ownerOf(0)).isEqualTo(USER);
        assertRejected(() -> restarted.getVault().submitRiskAnalysis(UPDATER, submission("bob", 100)),
                LedgerError.RATE_LIMITED);
    }

    @Test
    void configurationOutlivesTheDeployment() throws IOException {
        RiskSubmission first = submission("alice", 2500);
        VaultDeployment deployment = deploy();
        CommitmentLedger vault = deployment.getVault();
        vault.submitRiskAnalysis(UPDATER, first);
        vault.setCustomValidityPeriod(OWNER, first.getCommitment(), DAY);
        vault.setMinUpdateInterval(OWNER, 2 * HOUR);
        vault.setMaxDailyDecryptions(OWNER, 3);
        deployment.getPassportRegistry().setValidityPeriod(OWNER, 7 * DAY);
        deployment.getPassportRegistry().setApprovalForAll(USER, DAO, true);
        vault.pause(OWNER);

        VaultDeployment restarted = deploy(START_TIME + 2 * DAY);
        CommitmentLedger resumed = restarted.getVault();

        assertThat(resumed.isPaused()).isTrue();
        assertThat(resumed.getValidityPeriod(first.getCommitment())).isEqualTo(DAY);
        assertThat(resumed.hasValidScore(first.getCommitment())).isEqualTo(new ValidityStatus(true, false));
        VaultInfo info = resumed.getContractInfo();
        assertThat(info.getMinUpdateInterval()).isEqualTo(2 * HOUR);
        assertThat(info.getMaxDailyDecryptions()).isEqualTo(3);
        assertThat(info.getPassportNFT()).isEqualTo(PASSPORT_ADDRESS);
        assertThat(info.getProofVerifier()).isEqualTo(VERIFIER_ADDRESS);
        assertThat(restarted.getPassportRegistry().getValidityPeriod()).isEqualTo(7 * DAY);
        assertThat(restarted.getPassportRegistry().isApprovedForAll(USER, DAO)).isTrue();
        assertThat(resumed.isAuthorizedUpdater(UPDATER)).isTrue();
        assertRejected(() -> resumed.submitRiskAnalysis(UPDATER, submission("bob", 100)),
                LedgerError.CONTRACT_PAUSED);
    }

    @Test
    void ledgerConfigSurvivesReopening() throws IOException {
        assertThat(new JsonFileLedgerConfigRegistry(path()).load()).isNull();
        LedgerConfig config = LedgerConfig.builder()
                .paused(true)
                .minUpdateInterval(HOUR)
                .maxDailyDecryptions(10)
                .passportValidityPeriod(30 * DAY)
                .passportNFT(PASSPORT_ADDRESS)
                .proofVerifier(VERIFIER_ADDRESS)
                .build();
        config.getCustomValidityPeriods().put(hash("commitment").toHex(), DAY);
        new JsonFileLedgerConfigRegistry(path()).save(config);

        assertThat(new JsonFileLedgerConfigRegistry(path()).load()).isEqualTo(config);
    }

    @Test
    void operatorApprovalsArePersisted() throws IOException {
        JsonFilePassportTokenRegistry passports = new JsonFilePassportTokenRegistry(path());
        passports.setOperatorApproval(USER, DAO, true);
        passports.setOperatorApproval(USER, STRANGER, true);
        passports.setOperatorApproval(USER, STRANGER, false);

        JsonFilePassportTokenRegistry reopened = new JsonFilePassportTokenRegistry(path());
        assertThat(reopened.isOperatorApproved(USER, DAO)).isTrue();
        assertThat(reopened.isOperatorApproved(USER, STRANGER)).isFalse();
        assertThat(reopened.isOperatorApproved(DAO, USER)).isFalse();
    }

    private VaultDeployment deploy() throws IOException {
        return deploy(START_TIME);
    }

    private VaultDeployment deploy(long now) throws IOException {
        DeploymentSettings settings = DeploymentSettings.builder()
                .owner(OWNER)
                .vaultAddress(VAULT_ADDRESS)
                .passportAddress(PASSPORT_ADDRESS)
                .verifierAddress(VERIFIER_ADDRESS)
                .authorizedUpdater(UPDATER)
                .build();
        return new VaultDeployment(settings, new ManualLedgerClock(now, START_BLOCK), new ScriptedProofVerifier(),
                new PlaintextScoreEvaluator(),
                new JsonFileCommitmentRecordRegistry(path()), new JsonFileNullifierRegistry(path()),
                new JsonFileUpdaterStateRegistry(path()), new JsonFilePassportTokenRegistry(path()),
                new JsonFileLedgerConfigRegistry(path()));
    }

}
