package com.silentrisk.vault.repository;

import com.silentrisk.vault.model.ledger.LedgerConfig;
import com.silentrisk.vault.model.passport.Passport;
import com.silentrisk.vault.model.vault.CommitmentRecord;
import com.silentrisk.vault.model.vault.RiskBand;
import com.silentrisk.vault.model.vault.UpdaterState;
import com.silentrisk.vault.repository.ledger.InMemoryLedgerConfigRegistry;
import com.silentrisk.vault.repository.passport.InMemoryPassportTokenRegistry;
import com.silentrisk.vault.repository.vault.InMemoryCommitmentRecordRegistry;
import com.silentrisk.vault.repository.vault.InMemoryUpdaterStateRegistry;
import com.silentrisk.vault.service.crypto.PlaintextScoreEvaluator;
import org.junit.jupiter.api.Test;

import static com.silentrisk.vault.support.VaultFixture.*;
import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRegistriesTest {

    @Test
    void commitmentRecordsAreStoredByValue() {
        InMemoryCommitmentRecordRegistry registry = new InMemoryCommitmentRecordRegistry();
        CommitmentRecord record = CommitmentRecord.builder()
                .commitment(hash("commitment"))
                .encryptedScore(PlaintextScoreEvaluator.encode(4200))
                .timestamp(START_TIME)
                .blockHeight(TEST_BLOCK_HEIGHT)
                .band(RiskBand.MEDIUM)
                .analyzer(UPDATER)
                .build();
        registry.save(record);

        record.setBand(RiskBand.CRITICAL);
        registry.load(hash("commitment")).setTimestamp(0);
        registry.loadAll().get(0).setAnalyzer(STRANGER);

        CommitmentRecord stored = registry.load(hash("commitment"));
        assertThat(stored.getBand()).isEqualTo(RiskBand.MEDIUM);
        assertThat(stored.getTimestamp()).isEqualTo(START_TIME);
        assertThat(stored.getAnalyzer()).isEqualTo(UPDATER);
    }

    @Test
    void passportsAreStoredByValue() {
        InMemoryPassportTokenRegistry registry = new InMemoryPassportTokenRegistry();
        Passport passport = Passport.builder()
                .tokenId(0)
                .owner(USER)
                .commitment(hash("commitment"))
                .mintTime(START_TIME)
                .expiry(START_TIME + DAY)
                .build();
        registry.save(passport);

        passport.setExpiry(Long.MAX_VALUE);
        registry.load(0).setRevoked(true);

        Passport stored = registry.load(0);
        assertThat(stored.getExpiry()).isEqualTo(START_TIME + DAY);
        assertThat(stored.isRevoked()).isFalse();
    }

    @Test
    void updaterStatesAreStoredByValue() {
        InMemoryUpdaterStateRegistry registry = new InMemoryUpdaterStateRegistry();
        registry.save(UpdaterState.builder().account(UPDATER).authorized(true).build());

        registry.load(UPDATER).setAuthorized(false);
        registry.loadAll().get(0).setDecryptionsToday(99);

        UpdaterState stored = registry.load(UPDATER);
        assertThat(stored.isAuthorized()).isTrue();
        assertThat(stored.getDecryptionsToday()).isZero();
    }

    @Test
    void ledgerConfigIsStoredByValue() {
        InMemoryLedgerConfigRegistry registry = new InMemoryLedgerConfigRegistry();
        assertThat(registry.load()).isNull();

        LedgerConfig config = LedgerConfig.builder().minUpdateInterval(HOUR).build();
        registry.save(config);
        config.getCustomValidityPeriods().put(hash("commitment").toHex(), DAY);
        registry.load().setPaused(true);

        LedgerConfig stored = registry.load();
        assertThat(stored.isPaused()).isFalse();
        assertThat(stored.getMinUpdateInterval()).isEqualTo(HOUR);
        assertThat(stored.getCustomValidityPeriods()).isEmpty();
    }

}
