package com.silentrisk.vault.service.passport;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.ledger.Bytes32;

/**
 * What the vault may ask of the passport registry it is linked to.
 */
public interface PassportMinter {

    /**
     * @return the id of the freshly minted token
     */
    long mintFromVault(Address caller, Bytes32 commitment, Address recipient);

}
