package com.silentrisk.vault.service.passport;

import com.silentrisk.vault.model.event.PassportMinted;
import com.silentrisk.vault.model.event.PassportRevoked;
import com.silentrisk.vault.model.event.PassportTransferred;
import com.silentrisk.vault.model.event.ValidityPeriodUpdated;
import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.ledger.Bytes32;
import com.silentrisk.vault.model.passport.Passport;
import com.silentrisk.vault.model.passport.PassportValidity;
import com.silentrisk.vault.model.vault.RiskBand;
import com.silentrisk.vault.repository.passport.PassportTokenRegistry;
import com.silentrisk.vault.service.ledger.ContractDirectory;
import com.silentrisk.vault.service.ledger.LedgerConfigStore;
import com.silentrisk.vault.service.ledger.LedgerError;
import com.silentrisk.vault.service.ledger.LedgerException;
import com.silentrisk.vault.service.ledger.LedgerRuntime;
import com.silentrisk.vault.service.vault.EmergencyStop;
import com.silentrisk.vault.service.vault.RiskAttestationVault;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Transferable, time-boxed passport tokens, one per recorded commitment.
 * <p>
 * Only the vault bound at construction may mint, and every mint is re-checked against the vault's
 * own records. A token's commitment and expiry never change; the risk attestation travels with the token.
 */
@Slf4j
public class PassportRegistry implements PassportMinter {

    public static final long DEFAULT_VALIDITY_PERIOD = 30L * 24 * 60 * 60;
    public static final long MAX_VALIDITY_PERIOD = 365L * 24 * 60 * 60;

    private final Address address;
    private final Address vault;
    private final Address owner;
    private final LedgerRuntime runtime;
    private final ContractDirectory directory;
    private final EmergencyStop emergencyStop;
    private final PassportTokenRegistry passports;
    private final LedgerConfigStore config;

    public PassportRegistry(Address address,
                            Address vault,
                            Address owner,
                            LedgerRuntime runtime,
                            ContractDirectory directory,
                            EmergencyStop emergencyStop,
                            PassportTokenRegistry passports,
                            LedgerConfigStore config) {
        if (vault == null || vault.isZero()) {
            throw new LedgerException(LedgerError.INVALID_VAULT_ADDRESS, "Vault address must not be zero");
        }
        this.address = address;
        this.vault = vault;
        this.owner = owner;
        this.runtime = runtime;
        this.directory = directory;
        this.emergencyStop = emergencyStop;
        this.passports = passports;
        this.config = config;
    }

    // Minting

    @Override
    public long mintFromVault(Address caller, Bytes32 commitment, Address recipient) {
        return runtime.transact(caller, "mintFromVault", () -> {
            emergencyStop.requireNotPaused();
            if (!vault.equals(caller)) {
                throw LedgerException.of(LedgerError.ONLY_VAULT, "Only the vault may mint, not %s", caller);
            }
            if (recipient == null || recipient.isZero()) {
                throw new LedgerException(LedgerError.ZERO_ADDRESS, "Recipient must not be the zero address");
            }
            if (!resolveVault().commitmentExists(commitment)) {
                throw LedgerException.of(LedgerError.COMMITMENT_NOT_IN_VAULT, "Commitment %s is not in the vault", commitment);
            }
            Optional<Long> existing = passports.findByCommitment(commitment);
            if (existing.isPresent()) {
                throw LedgerException.of(LedgerError.PASSPORT_ALREADY_EXISTS,
                        "Passport %d already references commitment %s", existing.get(), commitment);
            }
            long tokenId = passports.count();
            long now = runtime.now();
            Passport passport = Passport.builder()
                    .tokenId(tokenId)
                    .owner(recipient)
                    .commitment(commitment)
                    .mintTime(now)
                    .expiry(now + config.current().getPassportValidityPeriod())
                    .build();
            passports.save(passport);
            runtime.onRollback(() -> passports.discard(tokenId));
            runtime.emit(address, new PassportMinted(tokenId, recipient, commitment, passport.getExpiry()));
            log.info("Minted passport {} to {} expiring at {}", tokenId, recipient, passport.getExpiry());
            return tokenId;
        });
    }

    // Validity and threshold queries

    public PassportValidity isPassportValid(long tokenId) {
        return runtime.view(() -> {
            Passport passport = passports.load(tokenId);
            if (passport == null) {
                return new PassportValidity(false, 0);
            }
            return new PassportValidity(passport.isValidAt(runtime.now()), passport.getExpiry());
        });
    }

    public boolean verifyRiskThreshold(Address caller, long tokenId, Bytes32 threshold, byte[] thresholdProof) {
        return runtime.transact(caller, "verifyRiskThresholdByPassport", () -> {
            Passport passport = requirePassport(tokenId);
            if (passport.isRevoked()) {
                throw LedgerException.of(LedgerError.PASSPORT_REVOKED, "Passport %d has been revoked", tokenId);
            }
            if (runtime.now() >= passport.getExpiry()) {
                throw LedgerException.of(LedgerError.PASSPORT_EXPIRED, "Passport %d has expired", tokenId);
            }
            return resolveVault().verifyRiskThreshold(address, passport.getCommitment(), threshold, thresholdProof);
        });
    }

    public Bytes32 getPassportCommitment(long tokenId) {
        return runtime.view(() -> requirePassport(tokenId).getCommitment());
    }

    public Address getPassportHolder(long tokenId) {
        return runtime.view(() -> requirePassport(tokenId).getOwner());
    }

    public RiskBand getPassportRiskBand(long tokenId) {
        return runtime.view(() -> resolveVault().getCommitmentRiskBand(requirePassport(tokenId).getCommitment()));
    }

    /**
     * A snapshot of the token. Changing it has no effect on the registry.
     */
    public Passport getPassport(long tokenId) {
        return runtime.view(() -> requirePassport(tokenId).toBuilder().build());
    }

    public Optional<Long> getTokenIdForCommitment(Bytes32 commitment) {
        return runtime.view(() -> passports.findByCommitment(commitment));
    }

    // Administration

    public void revokePassport(Address caller, long tokenId, String reason) {
        runtime.execute(caller, "revokePassport", () -> {
            requireOwner(caller);
            emergencyStop.requireNotPaused();
            Passport passport = requirePassport(tokenId);
            if (passport.isRevoked()) {
                throw LedgerException.of(LedgerError.PASSPORT_ALREADY_REVOKED, "Passport %d is already revoked", tokenId);
            }
            passports.save(passport.toBuilder().revoked(true).revocationReason(reason).build());
            runtime.onRollback(() -> passports.save(passport));
            runtime.emit(address, new PassportRevoked(tokenId, passport.getOwner(), reason));
            log.info("Revoked passport {}: {}", tokenId, reason);
        });
    }

    public void setValidityPeriod(Address caller, long newPeriod) {
        runtime.execute(caller, "setValidityPeriod", () -> {
            requireOwner(caller);
            emergencyStop.requireNotPaused();
            if (newPeriod <= 0 || newPeriod > MAX_VALIDITY_PERIOD) {
                throw LedgerException.of(LedgerError.INVALID_PERIOD, "Invalid period: %d", newPeriod);
            }
            long previous = config.update(c -> c.setPassportValidityPeriod(newPeriod)).getPassportValidityPeriod();
            runtime.emit(address, new ValidityPeriodUpdated(previous, newPeriod));
            log.info("Passport validity period changed from {} to {} seconds", previous, newPeriod);
        });
    }

    public long getValidityPeriod() {
        return runtime.view(() -> config.current().getPassportValidityPeriod());
    }

    // Ownership

    public Address ownerOf(long tokenId) {
        return runtime.view(() -> requirePassport(tokenId).getOwner());
    }

    public long balanceOf(Address holder) {
        if (holder == null || holder.isZero()) {
            throw new LedgerException(LedgerError.ZERO_ADDRESS, "Balance query for the zero address");
        }
        return runtime.view(() -> passports.countOwnedBy(holder));
    }

    public long totalSupply() {
        return runtime.view(passports::count);
    }

    public void approve(Address caller, Address approved, long tokenId) {
        runtime.execute(caller, "approve", () -> {
            emergencyStop.requireNotPaused();
            Passport passport = requirePassport(tokenId);
            if (!passport.getOwner().equals(caller) && !passports.isOperatorApproved(passport.getOwner(), caller)) {
                throw LedgerException.of(LedgerError.NOT_TOKEN_OWNER_OR_APPROVED,
                        "%s may not approve passport %d", caller, tokenId);
            }
            passports.save(passport.toBuilder().approved(approved).build());
            runtime.onRollback(() -> passports.save(passport));
            log.info("Passport {} approved for {} by {}", tokenId, approved, caller);
        });
    }

    public Address getApproved(long tokenId) {
        return runtime.view(() -> requirePassport(tokenId).getApproved());
    }

    public void setApprovalForAll(Address caller, Address operator, boolean approved) {
        runtime.execute(caller, "setApprovalForAll", () -> {
            emergencyStop.requireNotPaused();
            if (operator == null || operator.isZero() || operator.equals(caller)) {
                throw LedgerException.of(LedgerError.INVALID_ARGUMENT, "Invalid operator %s", operator);
            }
            boolean previous = passports.isOperatorApproved(caller, operator);
            if (previous != approved) {
                passports.setOperatorApproval(caller, operator, approved);
                runtime.onRollback(() -> passports.setOperatorApproval(caller, operator, previous));
            }
            log.info("Operator {} {} for holder {}", operator, approved ? "approved" : "withdrawn", caller);
        });
    }

    public boolean isApprovedForAll(Address holder, Address operator) {
        return runtime.view(() -> passports.isOperatorApproved(holder, operator));
    }

    /**
     * Moves a passport to a new holder. Commitment, expiry and revocation status are untouched.
     */
    public void transferFrom(Address caller, Address from, Address to, long tokenId) {
        runtime.execute(caller, "transferFrom", () -> {
            emergencyStop.requireNotPaused();
            Passport passport = requirePassport(tokenId);
            if (!passport.getOwner().equals(from)) {
                throw LedgerException.of(LedgerError.NOT_TOKEN_OWNER_OR_APPROVED,
                        "Passport %d is not held by %s", tokenId, from);
            }
            boolean permitted = caller.equals(from)
                    || caller.equals(passport.getApproved())
                    || passports.isOperatorApproved(from, caller);
            if (!permitted) {
                throw LedgerException.of(LedgerError.NOT_TOKEN_OWNER_OR_APPROVED,
                        "%s may not transfer passport %d", caller, tokenId);
            }
            if (to == null || to.isZero()) {
                throw new LedgerException(LedgerError.ZERO_ADDRESS, "Cannot transfer to the zero address");
            }
            passports.save(passport.toBuilder().owner(to).approved(null).build());
            runtime.onRollback(() -> passports.save(passport));
            runtime.emit(address, new PassportTransferred(from, to, tokenId));
            log.info("Passport {} transferred from {} to {}", tokenId, from, to);
        });
    }

    public Address getAddress() {
        return address;
    }

    public Address getVault() {
        return vault;
    }

    public Address getOwner() {
        return owner;
    }

    private Passport requirePassport(long tokenId) {
        Passport passport = passports.load(tokenId);
        if (passport == null) {
            throw LedgerException.of(LedgerError.PASSPORT_NOT_FOUND, "Passport %d does not exist", tokenId);
        }
        return passport;
    }

    private void requireOwner(Address caller) {
        if (!owner.equals(caller)) {
            throw LedgerException.of(LedgerError.OWNER_ONLY, "Caller %s is not the owner", caller);
        }
    }

    private RiskAttestationVault resolveVault() {
        return directory.lookup(vault, RiskAttestationVault.class)
                .orElseThrow(() -> LedgerException.of(LedgerError.INVALID_VAULT_ADDRESS, "No vault deployed at %s", vault));
    }

}
