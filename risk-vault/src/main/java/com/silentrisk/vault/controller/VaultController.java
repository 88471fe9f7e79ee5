package com.silentrisk.vault.controller;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.ledger.Bytes32;
import com.silentrisk.vault.model.vault.RiskSubmission;
import com.silentrisk.vault.model.vault.SubmissionResult;
import com.silentrisk.vault.service.crypto.CommitmentHasher;
import com.silentrisk.vault.service.ledger.LedgerException;
import com.silentrisk.vault.service.vault.CommitmentLedger;
import com.silentrisk.vault.util.HexUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/vault")
@RequiredArgsConstructor
@Tag(name = "Vault", description = "Endpoints for risk attestation submission and threshold queries")
public class VaultController {

    static final String CALLER_HEADER = "X-Caller-Address";

    private final CommitmentLedger vault;

    @Operation(summary = "Submit a risk analysis and mint the matching passport (authorized updaters only)")
    @PostMapping("/submissions")
    public ResponseEntity<?> submitRiskAnalysis(@RequestHeader(CALLER_HEADER) String caller,
                                                @Valid @RequestBody SubmitRequest request) {
        log.info("Submit risk analysis for commitment: {} from: {}", request.getCommitment(), caller);
        try {
            RiskSubmission submission = RiskSubmission.builder()
                    .commitment(Bytes32.fromHex(request.getCommitment()))
                    .encryptedScore(Bytes32.fromHex(request.getEncryptedScore()))
                    .scoreProof(HexUtils.decode(request.getScoreProof()))
                    .blockHeight(request.getBlockHeight())
                    .nullifierHash(Bytes32.fromHex(request.getNullifierHash()))
                    .addressProof(HexUtils.decode(request.getAddressProof()))
                    .recipient(Address.of(request.getRecipient()))
                    .build();
            SubmissionResult result = vault.submitRiskAnalysis(Address.of(caller), submission);
            return ResponseEntity.ok(result);
        } catch (LedgerException e) {
            log.warn("Risk analysis for commitment: {} rejected: {}", request.getCommitment(), e.getError());
            return LedgerResponses.rejected(e);
        } catch (IllegalArgumentException e) {
            return LedgerResponses.invalidInput(e);
        } catch (Exception e) {
            log.error("Failed to submit risk analysis for commitment: {}", request.getCommitment(), e);
            return LedgerResponses.failed("Submit risk analysis failed", e);
        }
    }

    @Operation(summary = "Check whether the committed risk score is strictly below a threshold")
    @PostMapping("/threshold")
    public ResponseEntity<?> verifyRiskThreshold(@RequestHeader(CALLER_HEADER) String caller,
                                                 @Valid @RequestBody ThresholdRequest request) {
        log.info("Verify risk threshold for commitment: {} from: {}", request.getCommitment(), caller);
        try {
            boolean below = vault.verifyRiskThreshold(
                    Address.of(caller),
                    Bytes32.fromHex(request.getCommitment()),
                    Bytes32.fromHex(request.getThreshold()),
                    HexUtils.decode(request.getProof()));
            return ResponseEntity.ok(Map.of("belowThreshold", below));
        } catch (LedgerException e) {
            log.warn("Threshold query for commitment: {} rejected: {}", request.getCommitment(), e.getError());
            return LedgerResponses.rejected(e);
        } catch (IllegalArgumentException e) {
            return LedgerResponses.invalidInput(e);
        } catch (Exception e) {
            log.error("Failed to verify risk threshold for commitment: {}", request.getCommitment(), e);
            return LedgerResponses.failed("Verify risk threshold failed", e);
        }
    }

    @Operation(summary = "Get the risk band recorded for a commitment (UNKNOWN if absent)")
    @GetMapping("/commitments/{commitment}/band")
    public ResponseEntity<?> getRiskBand(@PathVariable @NotBlank String commitment) {
        try {
            return ResponseEntity.ok(Map.of("band", vault.getRiskBand(Bytes32.fromHex(commitment))));
        } catch (IllegalArgumentException e) {
            return LedgerResponses.invalidInput(e);
        }
    }

    @Operation(summary = "Check whether a commitment exists and its score is still fresh")
    @GetMapping("/commitments/{commitment}/validity")
    public ResponseEntity<?> hasValidScore(@PathVariable @NotBlank String commitment) {
        try {
            return ResponseEntity.ok(vault.hasValidScore(Bytes32.fromHex(commitment)));
        } catch (IllegalArgumentException e) {
            return LedgerResponses.invalidInput(e);
        }
    }

    @Operation(summary = "Get the public metadata of a commitment")
    @GetMapping("/commitments/{commitment}/metadata")
    public ResponseEntity<?> getCommitmentMetadata(@PathVariable @NotBlank String commitment) {
        try {
            return ResponseEntity.ok(vault.getCommitmentMetadata(Bytes32.fromHex(commitment)));
        } catch (IllegalArgumentException e) {
            return LedgerResponses.invalidInput(e);
        }
    }

    @Operation(summary = "Get the validity period applied to a commitment, in seconds")
    @GetMapping("/commitments/{commitment}/validity-period")
    public ResponseEntity<?> getValidityPeriod(@PathVariable @NotBlank String commitment) {
        try {
            return ResponseEntity.ok(Map.of("validityPeriod", vault.getValidityPeriod(Bytes32.fromHex(commitment))));
        } catch (IllegalArgumentException e) {
            return LedgerResponses.invalidInput(e);
        }
    }

    @Operation(summary = "Check the validity of several commitments at once")
    @PostMapping("/commitments/validity")
    public ResponseEntity<?> batchCheckValidScores(@Valid @RequestBody BatchValidityRequest request) {
        log.info("Batch validity check for {} commitments", request.getCommitments().size());
        try {
            List<Bytes32> commitments = request.getCommitments().stream().map(Bytes32::fromHex).toList();
            return ResponseEntity.ok(vault.batchCheckValidScores(commitments));
        } catch (IllegalArgumentException e) {
            return LedgerResponses.invalidInput(e);
        }
    }

    @Operation(summary = "Check whether a nullifier has been consumed")
    @GetMapping("/nullifiers/{nullifier}")
    public ResponseEntity<?> isNullifierUsed(@PathVariable @NotBlank String nullifier) {
        try {
            return ResponseEntity.ok(Map.of("used", vault.isNullifierUsed(Bytes32.fromHex(nullifier))));
        } catch (IllegalArgumentException e) {
            return LedgerResponses.invalidInput(e);
        }
    }

    @Operation(summary = "Check whether an account is an authorized updater")
    @GetMapping("/updaters/{account}")
    public ResponseEntity<?> isAuthorizedUpdater(@PathVariable @NotBlank String account) {
        try {
            return ResponseEntity.ok(Map.of("authorized", vault.isAuthorizedUpdater(Address.of(account))));
        } catch (IllegalArgumentException e) {
            return LedgerResponses.invalidInput(e);
        }
    }

    @Operation(summary = "Count recorded commitments per risk band")
    @GetMapping("/statistics")
    public ResponseEntity<?> getScoreStatistics() {
        return ResponseEntity.ok(vault.getScoreStatistics());
    }

    @Operation(summary = "Get the vault constants and configuration")
    @GetMapping("/info")
    public ResponseEntity<?> getContractInfo() {
        return ResponseEntity.ok(vault.getContractInfo());
    }

    @Operation(summary = "Derive the commitment and nullifier for a wallet and secret (developer helper)")
    @PostMapping("/tools/commitment")
    public ResponseEntity<?> deriveCommitment(@Valid @RequestBody DeriveCommitmentRequest request) {
        try {
            Bytes32 secret = request.getSecret() != null
                    ? Bytes32.fromHex(request.getSecret())
                    : CommitmentHasher.randomSecret();
            Bytes32 commitment = CommitmentHasher.commitment(Address.of(request.getWallet()), secret);
            Bytes32 nullifier = CommitmentHasher.nullifier(secret, commitment);
            return ResponseEntity.ok(Map.of(
                    "secret", secret,
                    "commitment", commitment,
                    "nullifierHash", nullifier));
        } catch (IllegalArgumentException e) {
            return LedgerResponses.invalidInput(e);
        }
    }

    @Data
    public static class SubmitRequest {
        @NotBlank
        private String commitment;
        @NotBlank
        private String encryptedScore;
        @NotBlank
        private String scoreProof;
        private long blockHeight;
        @NotBlank
        private String nullifierHash;
        @NotBlank
        private String addressProof;
        @NotBlank
        private String recipient;
    }

    @Data
    public static class ThresholdRequest {
        @NotBlank
        private String commitment;
        @NotBlank
        private String threshold;
        @NotBlank
        private String proof;
    }

    @Data
    public static class BatchValidityRequest {
        @NotEmpty
        private List<String> commitments;
    }

    @Data
    public static class DeriveCommitmentRequest {
        @NotBlank
        private String wallet;
        private String secret;
    }

}
