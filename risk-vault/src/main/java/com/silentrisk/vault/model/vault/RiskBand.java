package com.silentrisk.vault.model.vault;

/**
 * Coarse risk classification disclosed in place of the score. Codes match the on-ledger enum ordinals.
 */
public enum RiskBand {

    UNKNOWN(0),
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int code;

    RiskBand(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

}
