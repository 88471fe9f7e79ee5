package com.silentrisk.vault.model.passport;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.ledger.Bytes32;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A passport token. {@code commitment}, {@code mintTime} and {@code expiry} are fixed at mint;
 * ownership and approval change with transfers.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Passport {

    private long tokenId;
    private Address owner;
    private Bytes32 commitment;
    private long mintTime;
    private long expiry;
    private boolean revoked;
    private String revocationReason;
    private Address approved;

    public boolean isValidAt(long now) {
        return now < expiry && !revoked;
    }

}
