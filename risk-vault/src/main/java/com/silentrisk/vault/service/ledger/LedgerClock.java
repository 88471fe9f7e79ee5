package com.silentrisk.vault.service.ledger;

/**
 * Source of ledger time (epoch seconds) and of the external chain height proofs may anchor to.
 */
public interface LedgerClock {

    long now();

    long currentBlockNumber();

}
