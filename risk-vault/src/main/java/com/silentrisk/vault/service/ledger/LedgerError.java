package com.silentrisk.vault.service.ledger;

/**
 * Machine-matchable rejection identifiers. Every rejected transaction carries exactly one.
 */
public enum LedgerError {

    // Authorization
    NOT_AUTHORIZED(Category.AUTHORIZATION),
    OWNER_ONLY(Category.AUTHORIZATION),
    ONLY_VAULT(Category.AUTHORIZATION),
    NOT_TOKEN_OWNER_OR_APPROVED(Category.AUTHORIZATION),

    // Lifecycle / availability
    CONTRACT_PAUSED(Category.LIFECYCLE),
    PASSPORT_NFT_NOT_SET(Category.LIFECYCLE),
    INVALID_VAULT_ADDRESS(Category.LIFECYCLE),
    INVALID_VERIFIER_ADDRESS(Category.LIFECYCLE),
    INVALID_PASSPORT_ADDRESS(Category.LIFECYCLE),

    // Input validity
    ZERO_ADDRESS(Category.INPUT),
    INVALID_BLOCK_HEIGHT(Category.INPUT),
    SCORE_EXCEEDS_MAXIMUM(Category.INPUT),
    INVALID_PERIOD(Category.INPUT),
    INTERVAL_TOO_LONG(Category.INPUT),
    INVALID_ARGUMENT(Category.INPUT),

    // Replay / uniqueness
    NULLIFIER_ALREADY_USED(Category.REPLAY),
    DUPLICATE_COMMITMENT(Category.REPLAY),
    PASSPORT_ALREADY_EXISTS(Category.REPLAY),
    PASSPORT_ALREADY_REVOKED(Category.REPLAY),

    // Throttling
    RATE_LIMITED(Category.THROTTLING),
    DECRYPTION_LIMIT_EXCEEDED(Category.THROTTLING),

    // Freshness
    RISK_SCORE_EXPIRED(Category.FRESHNESS),
    PASSPORT_EXPIRED(Category.FRESHNESS),
    PASSPORT_REVOKED(Category.FRESHNESS),

    // Cryptographic
    INVALID_PROOF(Category.CRYPTOGRAPHIC),
    COMMITMENT_NOT_IN_VAULT(Category.CRYPTOGRAPHIC),

    // Not found
    COMMITMENT_NOT_FOUND(Category.NOT_FOUND),
    PASSPORT_NOT_FOUND(Category.NOT_FOUND);

    public enum Category {
        AUTHORIZATION,
        LIFECYCLE,
        INPUT,
        REPLAY,
        THROTTLING,
        FRESHNESS,
        CRYPTOGRAPHIC,
        NOT_FOUND
    }

    private final Category category;

    LedgerError(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }

}
