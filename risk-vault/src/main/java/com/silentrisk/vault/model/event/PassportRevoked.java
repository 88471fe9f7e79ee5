package com.silentrisk.vault.model.event;

import com.silentrisk.vault.model.ledger.Address;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PassportRevoked implements LedgerEvent {

    private long tokenId;
    private Address owner;
    private String reason;

}
