package com.silentrisk.vault.service;

import com.silentrisk.vault.model.ledger.LedgerConfig;
import com.silentrisk.vault.repository.ledger.LedgerConfigRegistry;
import com.silentrisk.vault.repository.passport.PassportTokenRegistry;
import com.silentrisk.vault.repository.vault.CommitmentRecordRegistry;
import com.silentrisk.vault.repository.vault.NullifierRegistry;
import com.silentrisk.vault.repository.vault.UpdaterStateRegistry;
import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.service.crypto.HomomorphicScoreEvaluator;
import com.silentrisk.vault.service.crypto.ProofVerifier;
import com.silentrisk.vault.service.ledger.ContractDirectory;
import com.silentrisk.vault.service.ledger.EventLog;
import com.silentrisk.vault.service.ledger.LedgerClock;
import com.silentrisk.vault.service.ledger.LedgerConfigStore;
import com.silentrisk.vault.service.ledger.LedgerRuntime;
import com.silentrisk.vault.service.passport.PassportRegistry;
import com.silentrisk.vault.service.vault.AccessControl;
import com.silentrisk.vault.service.vault.CommitmentLedger;
import com.silentrisk.vault.service.vault.EmergencyStop;
import com.silentrisk.vault.service.vault.RateLimiter;
import com.silentrisk.vault.service.vault.ThresholdVerifier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Deploys the verifier, the vault and the passport registry onto a fresh ledger and links them
 * the way the deployment scripts do: verifier first, vault, registry bound to the vault,
 * then the owner links the registry and authorizes the initial updaters.
 * <p>
 * Over tables that already hold a deployment, the stored configuration wins over the settings and
 * only missing links and updaters are added.
 */
@Slf4j
@Getter
public class VaultDeployment {

    private final LedgerRuntime runtime;
    private final EventLog eventLog;
    private final ContractDirectory directory;
    private final LedgerConfigStore configStore;
    private final AccessControl accessControl;
    private final EmergencyStop emergencyStop;
    private final RateLimiter rateLimiter;
    private final CommitmentLedger vault;
    private final PassportRegistry passportRegistry;

    public VaultDeployment(DeploymentSettings settings,
                           LedgerClock clock,
                           ProofVerifier proofVerifier,
                           HomomorphicScoreEvaluator scoreEvaluator,
                           CommitmentRecordRegistry commitments,
                           NullifierRegistry nullifiers,
                           UpdaterStateRegistry updaterStates,
                           PassportTokenRegistry passports,
                           LedgerConfigRegistry configRegistry) {
        log.info("Deploy risk vault at {} and passport registry at {} for owner {}",
                settings.getVaultAddress(), settings.getPassportAddress(), settings.getOwner());
        this.eventLog = new EventLog();
        this.runtime = new LedgerRuntime(clock, eventLog);
        this.directory = new ContractDirectory();
        directory.deploy(settings.getVerifierAddress(), proofVerifier);
        this.configStore = new LedgerConfigStore(runtime, configRegistry, initialConfig(settings));

        this.accessControl = new AccessControl(runtime, settings.getVaultAddress(), settings.getOwner(), updaterStates);
        this.emergencyStop = new EmergencyStop(runtime, settings.getVaultAddress(), accessControl, configStore);
        this.rateLimiter = new RateLimiter(runtime, settings.getVaultAddress(), accessControl, updaterStates,
                emergencyStop, configStore);
        this.vault = new CommitmentLedger(
                settings.getVaultAddress(),
                runtime,
                directory,
                accessControl,
                emergencyStop,
                rateLimiter,
                new ThresholdVerifier(scoreEvaluator),
                scoreEvaluator,
                settings.getBandThresholds(),
                commitments,
                nullifiers,
                configStore,
                settings.getScoreValidityPeriod());
        directory.deploy(settings.getVaultAddress(), vault);

        this.passportRegistry = new PassportRegistry(
                settings.getPassportAddress(),
                settings.getVaultAddress(),
                settings.getOwner(),
                runtime,
                directory,
                emergencyStop,
                passports,
                configStore);
        directory.deploy(settings.getPassportAddress(), passportRegistry);

        Address owner = settings.getOwner();
        if (vault.getProofVerifier() == null) {
            vault.setProofVerifier(owner, settings.getVerifierAddress());
        }
        if (settings.isLinkPassport() && vault.getPassportNFT() == null) {
            vault.setPassportNFT(owner, settings.getPassportAddress());
        }
        for (Address updater : settings.getAuthorizedUpdaters()) {
            if (accessControl.isAuthorizedUpdater(updater)) {
                continue;
            }
            if (emergencyStop.isPaused()) {
                log.warn("Contract is paused; updater {} stays unauthorized until the owner adds it", updater);
                continue;
            }
            vault.setAuthorizedUpdater(owner, updater, true);
        }
    }

    private static LedgerConfig initialConfig(DeploymentSettings settings) {
        if (settings.getMinUpdateInterval() < 0 || settings.getMinUpdateInterval() > RateLimiter.MAX_UPDATE_INTERVAL) {
            throw new IllegalArgumentException("Minimum update interval out of range: " + settings.getMinUpdateInterval());
        }
        if (settings.getMaxDailyDecryptions() < 0) {
            throw new IllegalArgumentException("Daily decryption cap must not be negative: " + settings.getMaxDailyDecryptions());
        }
        long passportPeriod = settings.getPassportValidityPeriod();
        if (passportPeriod <= 0 || passportPeriod > PassportRegistry.MAX_VALIDITY_PERIOD) {
            throw new IllegalArgumentException("Passport validity period out of range: " + passportPeriod);
        }
        return LedgerConfig.builder()
                .minUpdateInterval(settings.getMinUpdateInterval())
                .maxDailyDecryptions(settings.getMaxDailyDecryptions())
                .passportValidityPeriod(passportPeriod)
                .build();
    }

}
