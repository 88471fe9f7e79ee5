package com.silentrisk.vault.service.ledger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock ledger time. The chain height is derived from the genesis instant and a fixed block time.
 */
public class SystemLedgerClock implements LedgerClock {

    private final Clock clock;
    private final Instant genesis;
    private final long blockTimeSeconds;

    public SystemLedgerClock(Clock clock, Instant genesis, Duration blockTime) {
        if (blockTime.isZero() || blockTime.isNegative()) {
            throw new IllegalArgumentException("Block time must be positive: " + blockTime);
        }
        this.clock = clock;
        this.genesis = genesis;
        this.blockTimeSeconds = Math.max(1, blockTime.getSeconds());
    }

    @Override
    public long now() {
        return clock.instant().getEpochSecond();
    }

    @Override
    public long currentBlockNumber() {
        long elapsed = now() - genesis.getEpochSecond();
        return elapsed <= 0 ? 0 : elapsed / blockTimeSeconds;
    }

}
