package com.silentrisk.vault.model.event;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.ledger.Bytes32;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PassportMinted implements LedgerEvent {

    private long tokenId;
    private Address recipient;
    private Bytes32 commitment;
    private long expiry;

}
