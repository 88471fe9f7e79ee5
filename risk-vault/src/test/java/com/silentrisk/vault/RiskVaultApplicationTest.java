package com.silentrisk.vault;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.vault.BandThresholds;
import com.silentrisk.vault.service.passport.PassportRegistry;
import com.silentrisk.vault.service.vault.CommitmentLedger;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class RiskVaultApplicationTest {

    @Autowired
    private CommitmentLedger vault;

    @Autowired
    private PassportRegistry passportRegistry;

    @Test
    void deploymentIsWiredFromConfiguration() {
        assertThat(vault.getAddress()).isEqualTo(Address.of("0x0000000000000000000000000000000000001001"));
        assertThat(vault.getPassportNFT()).isEqualTo(passportRegistry.getAddress());
        assertThat(vault.getProofVerifier()).isEqualTo(Address.of("0x0000000000000000000000000000000000001003"));
        assertThat(vault.getBandThresholds()).isEqualTo(BandThresholds.DEFAULT);
        assertThat(vault.isAuthorizedUpdater(Address.of("0x00000000000000000000000000000000000000b1"))).isTrue();
        assertThat(vault.getContractInfo().getMinUpdateInterval()).isZero();
        assertThat(passportRegistry.getVault()).isEqualTo(vault.getAddress());
        assertThat(passportRegistry.getValidityPeriod()).isEqualTo(30L * 24 * 60 * 60);
    }

}
