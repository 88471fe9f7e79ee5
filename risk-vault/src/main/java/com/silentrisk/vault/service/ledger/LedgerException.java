package com.silentrisk.vault.service.ledger;

/**
 * Thrown when a ledger transaction is rejected. The enclosing transaction is rolled back in full.
 */
public class LedgerException extends RuntimeException {

    private final LedgerError error;

    public LedgerException(LedgerError error, String message) {
        super(message);
        this.error = error;
    }

    public LedgerError getError() {
        return error;
    }

    public static LedgerException of(LedgerError error, String format, Object... args) {
        return new LedgerException(error, String.format(format, args));
    }

}
