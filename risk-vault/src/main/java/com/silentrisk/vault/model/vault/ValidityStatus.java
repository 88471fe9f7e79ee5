package com.silentrisk.vault.model.vault;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Distinguishes "never scored" ({@code exists == false}) from "scored but stale".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidityStatus {

    private boolean exists;
    private boolean valid;

}
