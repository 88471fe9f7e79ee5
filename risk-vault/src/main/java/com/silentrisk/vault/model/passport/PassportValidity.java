package com.silentrisk.vault.model.passport;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PassportValidity {

    private boolean valid;
    private long expiry;

}
