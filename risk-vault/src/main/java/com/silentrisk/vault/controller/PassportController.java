package com.silentrisk.vault.controller;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.ledger.Bytes32;
import com.silentrisk.vault.service.ledger.LedgerException;
import com.silentrisk.vault.service.passport.PassportRegistry;
import com.silentrisk.vault.util.HexUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

import static com.silentrisk.vault.controller.VaultController.CALLER_HEADER;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/passport")
@RequiredArgsConstructor
@Tag(name = "Passport", description = "Endpoints for risk passport lookup, threshold queries and transfers")
public class PassportController {

    private final PassportRegistry registry;

    @Operation(summary = "Get a passport by token id")
    @GetMapping("/{tokenId}")
    public ResponseEntity<?> getPassport(@PathVariable @Min(0) long tokenId) {
        try {
            return ResponseEntity.ok(registry.getPassport(tokenId));
        } catch (LedgerException e) {
            return LedgerResponses.rejected(e);
        }
    }

    @Operation(summary = "Check whether a passport is unrevoked and unexpired")
    @GetMapping("/{tokenId}/validity")
    public ResponseEntity<?> isPassportValid(@PathVariable @Min(0) long tokenId) {
        return ResponseEntity.ok(registry.isPassportValid(tokenId));
    }

    @Operation(summary = "Get the commitment bound to a passport")
    @GetMapping("/{tokenId}/commitment")
    public ResponseEntity<?> getPassportCommitment(@PathVariable @Min(0) long tokenId) {
        try {
            return ResponseEntity.ok(Map.of("commitment", registry.getPassportCommitment(tokenId)));
        } catch (LedgerException e) {
            return LedgerResponses.rejected(e);
        }
    }

    @Operation(summary = "Get the current holder of a passport")
    @GetMapping("/{tokenId}/holder")
    public ResponseEntity<?> getPassportHolder(@PathVariable @Min(0) long tokenId) {
        try {
            return ResponseEntity.ok(Map.of("holder", registry.getPassportHolder(tokenId)));
        } catch (LedgerException e) {
            return LedgerResponses.rejected(e);
        }
    }

    @Operation(summary = "Get the risk band of the commitment behind a passport")
    @GetMapping("/{tokenId}/band")
    public ResponseEntity<?> getPassportRiskBand(@PathVariable @Min(0) long tokenId) {
        try {
            return ResponseEntity.ok(Map.of("band", registry.getPassportRiskBand(tokenId)));
        } catch (LedgerException e) {
            return LedgerResponses.rejected(e);
        }
    }

    @Operation(summary = "Find the passport minted for a commitment")
    @GetMapping("/by-commitment/{commitment}")
    public ResponseEntity<?> getTokenIdForCommitment(@PathVariable @NotBlank String commitment) {
        try {
            return registry.getTokenIdForCommitment(Bytes32.fromHex(commitment))
                    .<ResponseEntity<?>>map(tokenId -> ResponseEntity.ok(Map.of("tokenId", tokenId)))
                    .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (IllegalArgumentException e) {
            return LedgerResponses.invalidInput(e);
        }
    }

    @Operation(summary = "Check whether the score behind a passport is strictly below a threshold")
    @PostMapping("/{tokenId}/threshold")
    public ResponseEntity<?> verifyRiskThreshold(@RequestHeader(CALLER_HEADER) String caller,
                                                 @PathVariable @Min(0) long tokenId,
                                                 @Valid @RequestBody ThresholdRequest request) {
        log.info("Verify risk threshold for passport: {} from: {}", tokenId, caller);
        try {
            boolean below = registry.verifyRiskThreshold(
                    Address.of(caller),
                    tokenId,
                    Bytes32.fromHex(request.getThreshold()),
                    HexUtils.decode(request.getProof()));
            return ResponseEntity.ok(Map.of("belowThreshold", below));
        } catch (LedgerException e) {
            log.warn("Threshold query for passport: {} rejected: {}", tokenId, e.getError());
            return LedgerResponses.rejected(e);
        } catch (IllegalArgumentException e) {
            return LedgerResponses.invalidInput(e);
        } catch (Exception e) {
            log.error("Failed to verify risk threshold for passport: {}", tokenId, e);
            return LedgerResponses.failed("Verify risk threshold failed", e);
        }
    }

    @Operation(summary = "Count passports held by an account")
    @GetMapping("/holders/{holder}/balance")
    public ResponseEntity<?> balanceOf(@PathVariable @NotBlank String holder) {
        try {
            return ResponseEntity.ok(Map.of("balance", registry.balanceOf(Address.of(holder))));
        } catch (LedgerException e) {
            return LedgerResponses.rejected(e);
        } catch (IllegalArgumentException e) {
            return LedgerResponses.invalidInput(e);
        }
    }

    @Operation(summary = "Count minted passports")
    @GetMapping("/total-supply")
    public ResponseEntity<?> totalSupply() {
        return ResponseEntity.ok(Map.of("totalSupply", registry.totalSupply()));
    }

    @Operation(summary = "Get the validity period applied to newly minted passports, in seconds")
    @GetMapping("/validity-period")
    public ResponseEntity<?> getValidityPeriod() {
        return ResponseEntity.ok(Map.of("validityPeriod", registry.getValidityPeriod()));
    }

    @Operation(summary = "Approve an account to transfer one passport")
    @PostMapping("/{tokenId}/approve")
    public ResponseEntity<?> approve(@RequestHeader(CALLER_HEADER) String caller,
                                     @PathVariable @Min(0) long tokenId,
                                     @Valid @RequestBody ApproveRequest request) {
        log.info("Approve {} for passport: {} by: {}", request.getApproved(), tokenId, caller);
        try {
            registry.approve(Address.of(caller), Address.of(request.getApproved()), tokenId);
            return ResponseEntity.ok(Map.of("tokenId", tokenId, "approved", request.getApproved()));
        } catch (LedgerException e) {
            log.warn("Approval for passport: {} rejected: {}", tokenId, e.getError());
            return LedgerResponses.rejected(e);
        } catch (IllegalArgumentException e) {
            return LedgerResponses.invalidInput(e);
        }
    }

    @Operation(summary = "Get the account approved for one passport")
    @GetMapping("/{tokenId}/approved")
    public ResponseEntity<?> getApproved(@PathVariable @Min(0) long tokenId) {
        try {
            Address approved = registry.getApproved(tokenId);
            return ResponseEntity.ok(Map.of("approved", approved == null ? Address.ZERO : approved));
        } catch (LedgerException e) {
            return LedgerResponses.rejected(e);
        }
    }

    @Operation(summary = "Grant or revoke an operator for all of the caller's passports")
    @PostMapping("/operators")
    public ResponseEntity<?> setApprovalForAll(@RequestHeader(CALLER_HEADER) String caller,
                                               @Valid @RequestBody OperatorRequest request) {
        log.info("Set operator {} to {} for holder: {}", request.getOperator(), request.isApproved(), caller);
        try {
            registry.setApprovalForAll(Address.of(caller), Address.of(request.getOperator()), request.isApproved());
            return ResponseEntity.ok(Map.of("operator", request.getOperator(), "approved", request.isApproved()));
        } catch (LedgerException e) {
            log.warn("Operator change for holder: {} rejected: {}", caller, e.getError());
            return LedgerResponses.rejected(e);
        } catch (IllegalArgumentException e) {
            return LedgerResponses.invalidInput(e);
        }
    }

    @Operation(summary = "Check whether an operator may manage all passports of a holder")
    @GetMapping("/operators")
    public ResponseEntity<?> isApprovedForAll(@RequestParam @NotBlank String holder,
                                              @RequestParam @NotBlank String operator) {
        try {
            return ResponseEntity.ok(Map.of("approved",
                    registry.isApprovedForAll(Address.of(holder), Address.of(operator))));
        } catch (IllegalArgumentException e) {
            return LedgerResponses.invalidInput(e);
        }
    }

    @Operation(summary = "Transfer a passport to a new holder")
    @PostMapping("/{tokenId}/transfer")
    public ResponseEntity<?> transferFrom(@RequestHeader(CALLER_HEADER) String caller,
                                          @PathVariable @Min(0) long tokenId,
                                          @Valid @RequestBody TransferRequest request) {
        log.info("Transfer passport: {} from: {} to: {} by: {}", tokenId, request.getFrom(), request.getTo(), caller);
        try {
            registry.transferFrom(Address.of(caller), Address.of(request.getFrom()), Address.of(request.getTo()), tokenId);
            return ResponseEntity.ok(registry.getPassport(tokenId));
        } catch (LedgerException e) {
            log.warn("Transfer of passport: {} rejected: {}", tokenId, e.getError());
            return LedgerResponses.rejected(e);
        } catch (IllegalArgumentException e) {
            return LedgerResponses.invalidInput(e);
        } catch (Exception e) {
            log.error("Failed to transfer passport: {}", tokenId, e);
            return LedgerResponses.failed("Transfer passport failed", e);
        }
    }

    @Data
    public static class ThresholdRequest {
        @NotBlank
        private String threshold;
        @NotBlank
        private String proof;
    }

    @Data
    public static class ApproveRequest {
        @NotBlank
        private String approved;
    }

    @Data
    public static class OperatorRequest {
        @NotBlank
        private String operator;
        private boolean approved;
    }

    @Data
    public static class TransferRequest {
        @NotBlank
        private String from;
        @NotBlank
        private String to;
    }

}
