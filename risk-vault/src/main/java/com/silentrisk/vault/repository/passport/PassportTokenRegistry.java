package com.silentrisk.vault.repository.passport;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.ledger.Bytes32;
import com.silentrisk.vault.model.passport.Passport;

import java.util.Optional;

/**
 * Passport tokens keyed by sequential token id, with a unique index on the bound commitment,
 * plus the operators each holder has approved for all of its tokens.
 */
public interface PassportTokenRegistry {

    void save(Passport passport);

    Passport load(long tokenId);

    boolean exists(long tokenId);

    Optional<Long> findByCommitment(Bytes32 commitment);

    long count();

    long countOwnedBy(Address owner);

    void setOperatorApproval(Address holder, Address operator, boolean approved);

    boolean isOperatorApproved(Address holder, Address operator);

    /**
     * Removes a token minted by a transaction that is being rolled back. Not a ledger operation.
     */
    void discard(long tokenId);

}
