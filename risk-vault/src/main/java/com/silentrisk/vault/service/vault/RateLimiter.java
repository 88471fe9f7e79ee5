package com.silentrisk.vault.service.vault;

import com.silentrisk.vault.model.event.ConfigurationUpdated;
import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.vault.UpdaterState;
import com.silentrisk.vault.repository.vault.UpdaterStateRegistry;
import com.silentrisk.vault.service.ledger.LedgerConfigStore;
import com.silentrisk.vault.service.ledger.LedgerError;
import com.silentrisk.vault.service.ledger.LedgerException;
import com.silentrisk.vault.service.ledger.LedgerRuntime;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-updater minimum submission interval and a per-account daily cap on threshold decryptions.
 * Day buckets are UTC days of ledger time; a counter resets when its bucket rolls over.
 */
@Slf4j
public class RateLimiter {

    public static final long MAX_UPDATE_INTERVAL = 24 * 60 * 60;
    public static final long SECONDS_PER_DAY = 24 * 60 * 60;

    private final LedgerRuntime runtime;
    private final Address contractAddress;
    private final AccessControl accessControl;
    private final UpdaterStateRegistry updaterStates;
    private final EmergencyStop emergencyStop;
    private final LedgerConfigStore config;

    public RateLimiter(LedgerRuntime runtime, Address contractAddress, AccessControl accessControl,
                       UpdaterStateRegistry updaterStates, EmergencyStop emergencyStop, LedgerConfigStore config) {
        this.runtime = runtime;
        this.contractAddress = contractAddress;
        this.accessControl = accessControl;
        this.updaterStates = updaterStates;
        this.emergencyStop = emergencyStop;
        this.config = config;
    }

    public long getMinUpdateInterval() {
        return config.current().getMinUpdateInterval();
    }

    public int getMaxDailyDecryptions() {
        return config.current().getMaxDailyDecryptions();
    }

    public void checkSubmission(Address updater, long now) {
        UpdaterState state = updaterStates.load(updater);
        if (state == null || state.getLastSubmissionTime() == 0) {
            return;
        }
        long nextAllowed = state.getLastSubmissionTime() + getMinUpdateInterval();
        if (now < nextAllowed) {
            throw LedgerException.of(LedgerError.RATE_LIMITED,
                    "Updater %s may submit again at %d (now %d)", updater, nextAllowed, now);
        }
    }

    /**
     * Records an accepted submission. Must run inside the submitting transaction.
     */
    public void recordSubmission(Address updater, long now) {
        UpdaterState previous = updaterStates.load(updater);
        UpdaterState base = previous != null ? previous : UpdaterState.fresh(updater);
        updaterStates.save(base.toBuilder().lastSubmissionTime(now).build());
        journal(updater, previous);
    }

    /**
     * Counts one threshold decryption against the account's daily cap. The owner is exempt.
     */
    public void consumeDecryption(Address account, long now) {
        if (accessControl.isOwner(account)) {
            return;
        }
        long bucket = now / SECONDS_PER_DAY;
        UpdaterState previous = updaterStates.load(account);
        UpdaterState base = previous != null ? previous : UpdaterState.fresh(account);
        int usedToday = base.getDayBucket() == bucket ? base.getDecryptionsToday() : 0;
        int maxDailyDecryptions = getMaxDailyDecryptions();
        if (usedToday >= maxDailyDecryptions) {
            throw LedgerException.of(LedgerError.DECRYPTION_LIMIT_EXCEEDED,
                    "Account %s reached the daily limit of %d threshold verifications", account, maxDailyDecryptions);
        }
        updaterStates.save(base.toBuilder().dayBucket(bucket).decryptionsToday(usedToday + 1).build());
        journal(account, previous);
    }

    public void setMinUpdateInterval(Address caller, long interval) {
        runtime.execute(caller, "setMinUpdateInterval", () -> {
            accessControl.requireOwner(caller);
            emergencyStop.requireNotPaused();
            if (interval > MAX_UPDATE_INTERVAL) {
                throw LedgerException.of(LedgerError.INTERVAL_TOO_LONG,
                        "Interval too long: %d exceeds %d seconds", interval, MAX_UPDATE_INTERVAL);
            }
            if (interval < 0) {
                throw LedgerException.of(LedgerError.INVALID_ARGUMENT, "Interval must not be negative: %d", interval);
            }
            long previous = config.update(c -> c.setMinUpdateInterval(interval)).getMinUpdateInterval();
            runtime.emit(contractAddress, new ConfigurationUpdated("minUpdateInterval",
                    Long.toString(previous), Long.toString(interval)));
            log.info("Minimum update interval changed from {} to {} seconds", previous, interval);
        });
    }

    public void setMaxDailyDecryptions(Address caller, int max) {
        runtime.execute(caller, "setMaxDailyDecryptions", () -> {
            accessControl.requireOwner(caller);
            emergencyStop.requireNotPaused();
            if (max < 0) {
                throw LedgerException.of(LedgerError.INVALID_ARGUMENT, "Daily cap must not be negative: %d", max);
            }
            int previous = config.update(c -> c.setMaxDailyDecryptions(max)).getMaxDailyDecryptions();
            runtime.emit(contractAddress, new ConfigurationUpdated("maxDailyDecryptions",
                    Integer.toString(previous), Integer.toString(max)));
            log.info("Daily decryption cap changed from {} to {}", previous, max);
        });
    }

    private void journal(Address account, UpdaterState previous) {
        runtime.onRollback(() -> {
            if (previous != null) {
                updaterStates.save(previous);
            } else {
                updaterStates.discard(account);
            }
        });
    }

}
