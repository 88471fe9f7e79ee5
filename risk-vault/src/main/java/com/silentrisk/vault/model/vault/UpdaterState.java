package com.silentrisk.vault.model.vault;

import com.silentrisk.vault.model.ledger.Address;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-account authorization and throttling state. Never deleted, only deauthorized.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UpdaterState {

    private Address account;
    private boolean authorized;
    private long lastSubmissionTime;
    private int decryptionsToday;
    private long dayBucket;

    public static UpdaterState fresh(Address account) {
        return UpdaterState.builder().account(account).build();
    }

}
