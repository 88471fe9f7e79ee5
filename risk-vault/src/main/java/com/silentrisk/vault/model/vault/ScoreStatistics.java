package com.silentrisk.vault.model.vault;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoreStatistics {

    private long low;
    private long medium;
    private long high;
    private long critical;

}
