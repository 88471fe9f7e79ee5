package com.silentrisk.vault.config;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.vault.BandThresholds;
import com.silentrisk.vault.repository.ledger.LedgerConfigRegistry;
import com.silentrisk.vault.repository.passport.PassportTokenRegistry;
import com.silentrisk.vault.repository.vault.CommitmentRecordRegistry;
import com.silentrisk.vault.repository.vault.NullifierRegistry;
import com.silentrisk.vault.repository.vault.UpdaterStateRegistry;
import com.silentrisk.vault.service.DeploymentSettings;
import com.silentrisk.vault.service.VaultDeployment;
import com.silentrisk.vault.service.crypto.HomomorphicScoreEvaluator;
import com.silentrisk.vault.service.crypto.PlaintextScoreEvaluator;
import com.silentrisk.vault.service.crypto.ProofVerifier;
import com.silentrisk.vault.service.crypto.StructuralProofVerifier;
import com.silentrisk.vault.service.ledger.EventLog;
import com.silentrisk.vault.service.ledger.LedgerClock;
import com.silentrisk.vault.service.ledger.SystemLedgerClock;
import com.silentrisk.vault.service.passport.PassportRegistry;
import com.silentrisk.vault.service.vault.CommitmentLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class LedgerContractsConfig {

    private final LedgerProperties ledgerProperties;
    private final VaultProperties vaultProperties;
    private final PassportProperties passportProperties;
    private final VerifierProperties verifierProperties;

    @Bean
    @ConditionalOnMissingBean
    public LedgerClock ledgerClock() {
        Instant genesis = ledgerProperties.getGenesisTime() != null
                ? ledgerProperties.getGenesisTime()
                : Instant.EPOCH;
        return new SystemLedgerClock(Clock.systemUTC(), genesis, ledgerProperties.getBlockTime());
    }

    @Bean
    @ConditionalOnMissingBean
    public ProofVerifier proofVerifier() {
        log.warn("Using the structural development proof verifier; proofs are not cryptographically checked");
        return new StructuralProofVerifier(verifierProperties.getMinProofLength());
    }

    @Bean
    @ConditionalOnMissingBean
    public HomomorphicScoreEvaluator homomorphicScoreEvaluator() {
        log.warn("Using the plaintext development score evaluator; encrypted score handles carry plaintext scores");
        return new PlaintextScoreEvaluator();
    }

    @Bean
    public DeploymentSettings deploymentSettings() {
        VaultProperties.Bands bands = vaultProperties.getBands();
        DeploymentSettings.DeploymentSettingsBuilder builder = DeploymentSettings.builder()
                .owner(Address.of(ledgerProperties.getOwner()))
                .vaultAddress(Address.of(ledgerProperties.getVaultAddress()))
                .passportAddress(Address.of(ledgerProperties.getPassportAddress()))
                .verifierAddress(Address.of(ledgerProperties.getVerifierAddress()))
                .minUpdateInterval(vaultProperties.getMinUpdateInterval().getSeconds())
                .maxDailyDecryptions(vaultProperties.getMaxDailyDecryptions())
                .scoreValidityPeriod(vaultProperties.getScoreValidityPeriod().getSeconds())
                .passportValidityPeriod(passportProperties.getValidityPeriod().getSeconds())
                .bandThresholds(new BandThresholds(bands.getMediumFrom(), bands.getHighFrom(), bands.getCriticalFrom()));
        vaultProperties.getAuthorizedUpdaters().forEach(updater -> builder.authorizedUpdater(Address.of(updater)));
        return builder.build();
    }

    @Bean
    public VaultDeployment vaultDeployment(DeploymentSettings settings,
                                           LedgerClock clock,
                                           ProofVerifier proofVerifier,
                                           HomomorphicScoreEvaluator scoreEvaluator,
                                           CommitmentRecordRegistry commitmentRecordRegistry,
                                           NullifierRegistry nullifierRegistry,
                                           UpdaterStateRegistry updaterStateRegistry,
                                           PassportTokenRegistry passportTokenRegistry,
                                           LedgerConfigRegistry ledgerConfigRegistry) {
        return new VaultDeployment(settings, clock, proofVerifier, scoreEvaluator,
                commitmentRecordRegistry, nullifierRegistry, updaterStateRegistry, passportTokenRegistry,
                ledgerConfigRegistry);
    }

    @Bean
    public CommitmentLedger commitmentLedger(VaultDeployment deployment) {
        return deployment.getVault();
    }

    @Bean
    public PassportRegistry passportRegistry(VaultDeployment deployment) {
        return deployment.getPassportRegistry();
    }

    @Bean
    public EventLog eventLog(VaultDeployment deployment) {
        return deployment.getEventLog();
    }

}
