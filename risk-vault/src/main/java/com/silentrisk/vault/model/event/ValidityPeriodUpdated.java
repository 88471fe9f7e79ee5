package com.silentrisk.vault.model.event;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidityPeriodUpdated implements LedgerEvent {

    private long oldPeriod;
    private long newPeriod;

}
