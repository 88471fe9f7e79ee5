package com.silentrisk.vault.model.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Owner-controlled configuration of the vault and the passport registry. Lives for the life of
 * the deployment, next to the ledger tables.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LedgerConfig {

    private boolean paused;
    private long minUpdateInterval;
    private int maxDailyDecryptions;
    private long passportValidityPeriod;
    private Address passportNFT;
    private Address proofVerifier;

    // commitment hex -> validity period in seconds
    @Builder.Default
    private Map<String, Long> customValidityPeriods = new HashMap<>();

    public LedgerConfig copy() {
        return toBuilder()
                .customValidityPeriods(customValidityPeriods == null
                        ? new HashMap<>()
                        : new HashMap<>(customValidityPeriods))
                .build();
    }

}
