package com.silentrisk.vault.service.vault;

import com.silentrisk.vault.model.event.ConfigurationUpdated;
import com.silentrisk.vault.model.event.DAOVerificationPerformed;
import com.silentrisk.vault.model.event.RiskAnalysisSubmitted;
import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.ledger.Bytes32;
import com.silentrisk.vault.model.vault.BandThresholds;
import com.silentrisk.vault.model.vault.BatchValidityResult;
import com.silentrisk.vault.model.vault.CommitmentMetadata;
import com.silentrisk.vault.model.vault.CommitmentRecord;
import com.silentrisk.vault.model.vault.RiskBand;
import com.silentrisk.vault.model.vault.RiskSubmission;
import com.silentrisk.vault.model.vault.ScoreStatistics;
import com.silentrisk.vault.model.vault.SubmissionResult;
import com.silentrisk.vault.model.vault.ValidityStatus;
import com.silentrisk.vault.model.vault.VaultInfo;
import com.silentrisk.vault.repository.vault.CommitmentRecordRegistry;
import com.silentrisk.vault.repository.vault.NullifierRegistry;
import com.silentrisk.vault.service.crypto.HomomorphicScoreEvaluator;
import com.silentrisk.vault.service.crypto.ProofVerifier;
import com.silentrisk.vault.service.ledger.ContractDirectory;
import com.silentrisk.vault.service.ledger.LedgerConfigStore;
import com.silentrisk.vault.service.ledger.LedgerError;
import com.silentrisk.vault.service.ledger.LedgerException;
import com.silentrisk.vault.service.ledger.LedgerRuntime;
import com.silentrisk.vault.service.passport.PassportMinter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The risk score vault: records one attestation per commitment, consumes one nullifier per
 * submission and mints the matching passport in the same transaction.
 * <p>
 * A commitment moves from absent to recorded exactly once. Validity is never stored; it is derived
 * from the record timestamp and the applicable validity period at query time.
 */
@Slf4j
public class CommitmentLedger implements RiskAttestationVault {

    public static final long DEFAULT_SCORE_VALIDITY_PERIOD = 30L * 24 * 60 * 60;
    public static final long MAX_VALIDITY_PERIOD = 365L * 24 * 60 * 60;

    private final Address address;
    private final LedgerRuntime runtime;
    private final ContractDirectory directory;
    private final AccessControl accessControl;
    private final EmergencyStop emergencyStop;
    private final RateLimiter rateLimiter;
    private final ThresholdVerifier thresholdVerifier;
    private final HomomorphicScoreEvaluator scoreEvaluator;
    private final BandThresholds bandThresholds;
    private final CommitmentRecordRegistry commitments;
    private final NullifierRegistry nullifiers;
    private final LedgerConfigStore config;
    private final long scoreValidityPeriod;

    public CommitmentLedger(Address address,
                            LedgerRuntime runtime,
                            ContractDirectory directory,
                            AccessControl accessControl,
                            EmergencyStop emergencyStop,
                            RateLimiter rateLimiter,
                            ThresholdVerifier thresholdVerifier,
                            HomomorphicScoreEvaluator scoreEvaluator,
                            BandThresholds bandThresholds,
                            CommitmentRecordRegistry commitments,
                            NullifierRegistry nullifiers,
                            LedgerConfigStore config,
                            long scoreValidityPeriod) {
        if (scoreValidityPeriod <= 0 || scoreValidityPeriod > MAX_VALIDITY_PERIOD) {
            throw new IllegalArgumentException("Score validity period out of range: " + scoreValidityPeriod);
        }
        this.address = address;
        this.runtime = runtime;
        this.directory = directory;
        this.accessControl = accessControl;
        this.emergencyStop = emergencyStop;
        this.rateLimiter = rateLimiter;
        this.thresholdVerifier = thresholdVerifier;
        this.scoreEvaluator = scoreEvaluator;
        this.bandThresholds = bandThresholds;
        this.commitments = commitments;
        this.nullifiers = nullifiers;
        this.config = config;
        this.scoreValidityPeriod = scoreValidityPeriod;
    }

    // Submission

    public SubmissionResult submitRiskAnalysis(Address caller, RiskSubmission submission) {
        return runtime.transact(caller, "submitRiskAnalysis", () -> {
            emergencyStop.requireNotPaused();
            accessControl.requireAuthorizedUpdater(caller);
            PassportMinter passport = resolvePassport();
            if (submission.getRecipient() == null || submission.getRecipient().isZero()) {
                throw new LedgerException(LedgerError.ZERO_ADDRESS, "Recipient must not be the zero address");
            }
            long now = runtime.now();
            validateBlockHeight(submission.getBlockHeight());
            rateLimiter.checkSubmission(caller, now);

            Bytes32 commitment = submission.getCommitment();
            Bytes32 nullifier = submission.getNullifierHash();
            if (commitment == null || nullifier == null || submission.getEncryptedScore() == null) {
                throw new LedgerException(LedgerError.INVALID_ARGUMENT,
                        "Commitment, nullifier and encrypted score are required");
            }
            if (nullifiers.isUsed(nullifier)) {
                throw LedgerException.of(LedgerError.NULLIFIER_ALREADY_USED, "Nullifier %s already used", nullifier);
            }
            verifySubmissionProofs(submission);
            RiskBand band = scoreEvaluator.classify(submission.getEncryptedScore(), bandThresholds);

            if (commitments.exists(commitment)) {
                throw LedgerException.of(LedgerError.DUPLICATE_COMMITMENT, "Commitment %s already recorded", commitment);
            }
            CommitmentRecord record = CommitmentRecord.builder()
                    .commitment(commitment)
                    .encryptedScore(submission.getEncryptedScore())
                    .timestamp(now)
                    .blockHeight(submission.getBlockHeight())
                    .band(band)
                    .analyzer(caller)
                    .build();
            commitments.save(record);
            runtime.onRollback(() -> commitments.discard(commitment));
            nullifiers.consume(nullifier, now);
            runtime.onRollback(() -> nullifiers.discard(nullifier));
            rateLimiter.recordSubmission(caller, now);

            runtime.emit(address, new RiskAnalysisSubmitted(
                    commitment, nullifier, caller, band, submission.getBlockHeight(), now));
            long tokenId = passport.mintFromVault(address, commitment, submission.getRecipient());

            log.info("Recorded commitment {} in band {} by {}, passport {}", commitment, band, caller, tokenId);
            return new SubmissionResult(band, tokenId);
        });
    }

    private PassportMinter resolvePassport() {
        Address passportNFT = config.current().getPassportNFT();
        if (passportNFT == null) {
            throw new LedgerException(LedgerError.PASSPORT_NFT_NOT_SET, "Passport NFT address not configured");
        }
        return directory.lookup(passportNFT, PassportMinter.class)
                .orElseThrow(() -> LedgerException.of(LedgerError.PASSPORT_NFT_NOT_SET,
                        "No passport registry deployed at %s", passportNFT));
    }

    private void validateBlockHeight(long blockHeight) {
        if (blockHeight <= 0) {
            throw LedgerException.of(LedgerError.INVALID_BLOCK_HEIGHT, "Block height must be positive: %d", blockHeight);
        }
        long current = runtime.currentBlockNumber();
        if (blockHeight > current) {
            throw LedgerException.of(LedgerError.INVALID_BLOCK_HEIGHT,
                    "Block height %d is ahead of the current block %d", blockHeight, current);
        }
    }

    private void verifySubmissionProofs(RiskSubmission submission) {
        ProofVerifier verifier = resolveVerifier();
        List<Bytes32> ownershipInputs = List.of(
                submission.getCommitment(),
                submission.getNullifierHash(),
                Bytes32.fromUnsigned(submission.getBlockHeight()));
        if (!verifier.verify(submission.getAddressProof(), ownershipInputs)) {
            throw LedgerException.of(LedgerError.INVALID_PROOF,
                    "Ownership proof rejected for commitment %s", submission.getCommitment());
        }
        List<Bytes32> scoreInputs = List.of(submission.getCommitment(), submission.getEncryptedScore());
        if (!verifier.verify(submission.getScoreProof(), scoreInputs)) {
            throw LedgerException.of(LedgerError.INVALID_PROOF,
                    "Score binding proof rejected for commitment %s", submission.getCommitment());
        }
    }

    private ProofVerifier resolveVerifier() {
        Address proofVerifier = config.current().getProofVerifier();
        return directory.lookup(proofVerifier, ProofVerifier.class)
                .orElseThrow(() -> LedgerException.of(LedgerError.INVALID_VERIFIER_ADDRESS,
                        "No proof verifier deployed at %s", proofVerifier));
    }

    // Threshold verification

    @Override
    public boolean verifyRiskThreshold(Address caller, Bytes32 commitment, Bytes32 threshold, byte[] thresholdProof) {
        return runtime.transact(caller, "verifyRiskThreshold", () -> {
            CommitmentRecord record = commitments.load(commitment);
            if (record == null) {
                throw LedgerException.of(LedgerError.COMMITMENT_NOT_FOUND, "Commitment %s does not exist", commitment);
            }
            long now = runtime.now();
            if (!isFresh(record, now)) {
                throw LedgerException.of(LedgerError.RISK_SCORE_EXPIRED, "Risk score for %s has expired", commitment);
            }
            Address requester = runtime.origin();
            rateLimiter.consumeDecryption(requester, now);
            boolean below = thresholdVerifier.isBelowThreshold(resolveVerifier(), record, threshold, thresholdProof);
            runtime.emit(address, new DAOVerificationPerformed(commitment, requester, below, now));
            return below;
        });
    }

    // Reads

    @Override
    public boolean commitmentExists(Bytes32 commitment) {
        return runtime.view(() -> commitments.exists(commitment));
    }

    public RiskBand getRiskBand(Bytes32 commitment) {
        return getCommitmentRiskBand(commitment);
    }

    @Override
    public RiskBand getCommitmentRiskBand(Bytes32 commitment) {
        return runtime.view(() -> {
            CommitmentRecord record = commitments.load(commitment);
            return record == null ? RiskBand.UNKNOWN : record.getBand();
        });
    }

    public ValidityStatus hasValidScore(Bytes32 commitment) {
        return runtime.view(() -> {
            CommitmentRecord record = commitments.load(commitment);
            if (record == null) {
                return new ValidityStatus(false, false);
            }
            return new ValidityStatus(true, isFresh(record, runtime.now()));
        });
    }

    public BatchValidityResult batchCheckValidScores(List<Bytes32> requested) {
        return runtime.view(() -> {
            long now = runtime.now();
            List<Boolean> valid = new ArrayList<>(requested.size());
            List<RiskBand> bands = new ArrayList<>(requested.size());
            for (Bytes32 commitment : requested) {
                CommitmentRecord record = commitment == null ? null : commitments.load(commitment);
                valid.add(record != null && isFresh(record, now));
                bands.add(record == null ? RiskBand.UNKNOWN : record.getBand());
            }
            return new BatchValidityResult(new ArrayList<>(requested), valid, bands);
        });
    }

    public CommitmentMetadata getCommitmentMetadata(Bytes32 commitment) {
        return runtime.view(() -> {
            CommitmentRecord record = commitments.load(commitment);
            if (record == null) {
                return CommitmentMetadata.absent();
            }
            return new CommitmentMetadata(record.getTimestamp(), record.getBlockHeight(), record.getBand(),
                    record.getAnalyzer(), true);
        });
    }

    public boolean isNullifierUsed(Bytes32 nullifier) {
        return runtime.view(() -> nullifiers.isUsed(nullifier));
    }

    public long getTotalScoredAddresses() {
        return runtime.view(commitments::count);
    }

    public ScoreStatistics getScoreStatistics() {
        return runtime.view(() -> {
            long low = 0, medium = 0, high = 0, critical = 0;
            for (CommitmentRecord record : commitments.loadAll()) {
                switch (record.getBand()) {
                    case LOW -> low++;
                    case MEDIUM -> medium++;
                    case HIGH -> high++;
                    case CRITICAL -> critical++;
                    default -> { }
                }
            }
            return new ScoreStatistics(low, medium, high, critical);
        });
    }

    public VaultInfo getContractInfo() {
        return runtime.view(() -> VaultInfo.builder()
                .scorePrecision(BandThresholds.SCORE_PRECISION)
                .maxRiskScore(BandThresholds.MAX_RISK_SCORE)
                .scoreValidityPeriod(scoreValidityPeriod)
                .owner(accessControl.getOwner())
                .totalScoredAddresses(commitments.count())
                .paused(emergencyStop.isPaused())
                .passportNFT(config.current().getPassportNFT())
                .proofVerifier(config.current().getProofVerifier())
                .minUpdateInterval(rateLimiter.getMinUpdateInterval())
                .maxDailyDecryptions(rateLimiter.getMaxDailyDecryptions())
                .build());
    }

    public long getValidityPeriod(Bytes32 commitment) {
        return runtime.view(() -> validityPeriodOf(commitment));
    }

    public Address getAddress() {
        return address;
    }

    public Address getPassportNFT() {
        return runtime.view(() -> config.current().getPassportNFT());
    }

    public Address getProofVerifier() {
        return runtime.view(() -> config.current().getProofVerifier());
    }

    public BandThresholds getBandThresholds() {
        return bandThresholds;
    }

    // Administration

    public void setPassportNFT(Address caller, Address passport) {
        runtime.execute(caller, "setPassportNFT", () -> {
            accessControl.requireOwner(caller);
            emergencyStop.requireNotPaused();
            if (passport == null || passport.isZero()) {
                throw new LedgerException(LedgerError.INVALID_PASSPORT_ADDRESS, "Passport address must not be zero");
            }
            Address previous = config.update(c -> c.setPassportNFT(passport)).getPassportNFT();
            runtime.emit(address, new ConfigurationUpdated("passportNFT", Objects.toString(previous), passport.toHex()));
            log.info("Passport NFT linked at {}", passport);
        });
    }

    public void setProofVerifier(Address caller, Address verifier) {
        runtime.execute(caller, "setProofVerifier", () -> {
            accessControl.requireOwner(caller);
            emergencyStop.requireNotPaused();
            if (verifier == null || verifier.isZero() || directory.lookup(verifier, ProofVerifier.class).isEmpty()) {
                throw LedgerException.of(LedgerError.INVALID_VERIFIER_ADDRESS, "No proof verifier deployed at %s", verifier);
            }
            Address previous = config.update(c -> c.setProofVerifier(verifier)).getProofVerifier();
            runtime.emit(address, new ConfigurationUpdated("proofVerifier", Objects.toString(previous), verifier.toHex()));
            log.info("Proof verifier set to {}", verifier);
        });
    }

    /**
     * Overrides the validity period of one commitment. A period of zero removes the override.
     */
    public void setCustomValidityPeriod(Address caller, Bytes32 commitment, long period) {
        runtime.execute(caller, "setCustomValidityPeriod", () -> {
            accessControl.requireOwner(caller);
            emergencyStop.requireNotPaused();
            if (commitment == null) {
                throw new LedgerException(LedgerError.INVALID_ARGUMENT, "Commitment is required");
            }
            if (period < 0 || period > MAX_VALIDITY_PERIOD) {
                throw LedgerException.of(LedgerError.INVALID_PERIOD, "Invalid period: %d", period);
            }
            String key = commitment.toHex();
            Long previous = config.update(c -> {
                if (period == 0) {
                    c.getCustomValidityPeriods().remove(key);
                } else {
                    c.getCustomValidityPeriods().put(key, period);
                }
            }).getCustomValidityPeriods().get(key);
            runtime.emit(address, new ConfigurationUpdated("customValidityPeriod:" + commitment,
                    Objects.toString(previous), Long.toString(period)));
            log.info("Validity period of {} set to {} seconds", commitment, period);
        });
    }

    public void setAuthorizedUpdater(Address caller, Address updater, boolean authorized) {
        runtime.execute(caller, "setAuthorizedUpdater", () -> {
            accessControl.requireOwner(caller);
            emergencyStop.requireNotPaused();
            accessControl.setAuthorizedUpdater(caller, updater, authorized);
        });
    }

    public boolean isAuthorizedUpdater(Address account) {
        return runtime.view(() -> accessControl.isAuthorizedUpdater(account));
    }

    public void setMinUpdateInterval(Address caller, long interval) {
        rateLimiter.setMinUpdateInterval(caller, interval);
    }

    public void setMaxDailyDecryptions(Address caller, int max) {
        rateLimiter.setMaxDailyDecryptions(caller, max);
    }

    public void pause(Address caller) {
        emergencyStop.pause(caller);
    }

    public void unpause(Address caller) {
        emergencyStop.unpause(caller);
    }

    public boolean isPaused() {
        return runtime.view(emergencyStop::isPaused);
    }

    private boolean isFresh(CommitmentRecord record, long now) {
        return now < record.getTimestamp() + validityPeriodOf(record.getCommitment());
    }

    private long validityPeriodOf(Bytes32 commitment) {
        Long custom = config.current().getCustomValidityPeriods().get(commitment.toHex());
        return custom != null ? custom : scoreValidityPeriod;
    }

}
