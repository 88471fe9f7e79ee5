package com.silentrisk.vault.model.event;

import com.silentrisk.vault.model.ledger.Address;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EventRecord {

    private long sequence;
    private long timestamp;
    private Address emitter;
    private String name;
    private LedgerEvent event;

}
