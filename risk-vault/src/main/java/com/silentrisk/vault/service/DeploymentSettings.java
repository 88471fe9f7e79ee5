package com.silentrisk.vault.service;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.vault.BandThresholds;
import com.silentrisk.vault.service.passport.PassportRegistry;
import com.silentrisk.vault.service.vault.CommitmentLedger;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

/**
 * Addresses and initial parameters of one deployment of the contract pair.
 */
@Getter
@Builder
public class DeploymentSettings {

    private final Address owner;
    private final Address vaultAddress;
    private final Address passportAddress;
    private final Address verifierAddress;

    @Builder.Default
    private final long minUpdateInterval = 60 * 60;
    @Builder.Default
    private final int maxDailyDecryptions = 10;
    @Builder.Default
    private final long scoreValidityPeriod = CommitmentLedger.DEFAULT_SCORE_VALIDITY_PERIOD;
    @Builder.Default
    private final long passportValidityPeriod = PassportRegistry.DEFAULT_VALIDITY_PERIOD;
    @Builder.Default
    private final BandThresholds bandThresholds = BandThresholds.DEFAULT;
    @Singular
    private final List<Address> authorizedUpdaters;

    // When false the vault starts without a passport link, as right after deploying the vault alone
    @Builder.Default
    private final boolean linkPassport = true;

}
