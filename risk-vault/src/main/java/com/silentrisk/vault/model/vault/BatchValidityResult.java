package com.silentrisk.vault.model.vault;

import com.silentrisk.vault.model.ledger.Bytes32;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Parallel lists in the order of the queried commitments.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchValidityResult {

    private List<Bytes32> commitments;
    private List<Boolean> hasValidScore;
    private List<RiskBand> bands;

}
