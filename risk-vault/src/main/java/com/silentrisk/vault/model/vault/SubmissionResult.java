package com.silentrisk.vault.model.vault;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionResult {

    private RiskBand band;
    private long passportTokenId;

}
