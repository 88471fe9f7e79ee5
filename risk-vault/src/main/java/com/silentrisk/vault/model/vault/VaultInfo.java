package com.silentrisk.vault.model.vault;

import com.silentrisk.vault.model.ledger.Address;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VaultInfo {

    private int scorePrecision;
    private int maxRiskScore;
    private long scoreValidityPeriod;
    private Address owner;
    private long totalScoredAddresses;
    private boolean paused;
    private Address passportNFT;
    private Address proofVerifier;
    private long minUpdateInterval;
    private int maxDailyDecryptions;

}
