package com.silentrisk.vault.model.event;

import com.silentrisk.vault.model.ledger.Address;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PassportTransferred implements LedgerEvent {

    private Address from;
    private Address to;
    private long tokenId;

}
