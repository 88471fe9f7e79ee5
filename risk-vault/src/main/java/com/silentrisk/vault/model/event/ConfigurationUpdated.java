package com.silentrisk.vault.model.event;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConfigurationUpdated implements LedgerEvent {

    private String key;
    private String oldValue;
    private String newValue;

}
