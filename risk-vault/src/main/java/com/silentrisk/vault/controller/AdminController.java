package com.silentrisk.vault.controller;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.ledger.Bytes32;
import com.silentrisk.vault.service.ledger.LedgerException;
import com.silentrisk.vault.service.passport.PassportRegistry;
import com.silentrisk.vault.service.vault.CommitmentLedger;
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

/**
 * Owner operations of the vault and the passport registry. Ownership is checked by the ledger,
 * not here.
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Tag(name = "Admin", description = "Owner-only configuration of the vault and the passport registry")
public class AdminController {

    private final CommitmentLedger vault;
    private final PassportRegistry registry;

    @Operation(summary = "Pause submissions, minting and transfers")
    @PostMapping("/vault/pause")
    public ResponseEntity<?> pause(@RequestHeader(CALLER_HEADER) String caller) {
        log.info("Pause requested by: {}", caller);
        return apply("pause", () -> vault.pause(Address.of(caller)));
    }

    @Operation(summary = "Resume submissions, minting and transfers")
    @PostMapping("/vault/unpause")
    public ResponseEntity<?> unpause(@RequestHeader(CALLER_HEADER) String caller) {
        log.info("Unpause requested by: {}", caller);
        return apply("unpause", () -> vault.unpause(Address.of(caller)));
    }

    @Operation(summary = "Grant or revoke updater rights")
    @PostMapping("/vault/updaters")
    public ResponseEntity<?> setAuthorizedUpdater(@RequestHeader(CALLER_HEADER) String caller,
                                                  @Valid @RequestBody UpdaterRequest request) {
        log.info("Set updater {} authorized={} by: {}", request.getUpdater(), request.isAuthorized(), caller);
        return apply("setAuthorizedUpdater", () ->
                vault.setAuthorizedUpdater(Address.of(caller), Address.of(request.getUpdater()), request.isAuthorized()));
    }

    @Operation(summary = "Set the minimum interval between submissions of one updater, in seconds")
    @PutMapping("/vault/min-update-interval")
    public ResponseEntity<?> setMinUpdateInterval(@RequestHeader(CALLER_HEADER) String caller,
                                                  @Valid @RequestBody ValueRequest request) {
        log.info("Set min update interval to {} by: {}", request.getValue(), caller);
        return apply("setMinUpdateInterval", () -> vault.setMinUpdateInterval(Address.of(caller), request.getValue()));
    }

    @Operation(summary = "Set the daily threshold query quota per requester")
    @PutMapping("/vault/max-daily-decryptions")
    public ResponseEntity<?> setMaxDailyDecryptions(@RequestHeader(CALLER_HEADER) String caller,
                                                    @Valid @RequestBody ValueRequest request) {
        log.info("Set max daily decryptions to {} by: {}", request.getValue(), caller);
        return apply("setMaxDailyDecryptions", () ->
                vault.setMaxDailyDecryptions(Address.of(caller), Math.toIntExact(request.getValue())));
    }

    @Operation(summary = "Link the passport registry the vault mints through")
    @PutMapping("/vault/passport-nft")
    public ResponseEntity<?> setPassportNFT(@RequestHeader(CALLER_HEADER) String caller,
                                            @Valid @RequestBody AddressRequest request) {
        log.info("Set passport NFT to {} by: {}", request.getAddress(), caller);
        return apply("setPassportNFT", () -> vault.setPassportNFT(Address.of(caller), Address.of(request.getAddress())));
    }

    @Operation(summary = "Point the vault at a deployed proof verifier")
    @PutMapping("/vault/proof-verifier")
    public ResponseEntity<?> setProofVerifier(@RequestHeader(CALLER_HEADER) String caller,
                                              @Valid @RequestBody AddressRequest request) {
        log.info("Set proof verifier to {} by: {}", request.getAddress(), caller);
        return apply("setProofVerifier", () -> vault.setProofVerifier(Address.of(caller), Address.of(request.getAddress())));
    }

    @Operation(summary = "Override the validity period of one commitment; zero clears the override")
    @PutMapping("/vault/commitments/{commitment}/validity-period")
    public ResponseEntity<?> setCustomValidityPeriod(@RequestHeader(CALLER_HEADER) String caller,
                                                     @PathVariable @NotBlank String commitment,
                                                     @Valid @RequestBody ValueRequest request) {
        log.info("Set validity period of {} to {} by: {}", commitment, request.getValue(), caller);
        return apply("setCustomValidityPeriod", () ->
                vault.setCustomValidityPeriod(Address.of(caller), Bytes32.fromHex(commitment), request.getValue()));
    }

    @Operation(summary = "Revoke a passport")
    @PostMapping("/passport/{tokenId}/revoke")
    public ResponseEntity<?> revokePassport(@RequestHeader(CALLER_HEADER) String caller,
                                            @PathVariable @Min(0) long tokenId,
                                            @Valid @RequestBody RevokeRequest request) {
        log.info("Revoke passport: {} by: {}", tokenId, caller);
        return apply("revokePassport", () -> registry.revokePassport(Address.of(caller), tokenId, request.getReason()));
    }

    @Operation(summary = "Set the validity period of newly minted passports, in seconds")
    @PutMapping("/passport/validity-period")
    public ResponseEntity<?> setPassportValidityPeriod(@RequestHeader(CALLER_HEADER) String caller,
                                                       @Valid @RequestBody ValueRequest request) {
        log.info("Set passport validity period to {} by: {}", request.getValue(), caller);
        return apply("setValidityPeriod", () -> registry.setValidityPeriod(Address.of(caller), request.getValue()));
    }

    private ResponseEntity<?> apply(String action, Runnable change) {
        try {
            change.run();
            return ResponseEntity.ok(Map.of("status", action + " applied"));
        } catch (LedgerException e) {
            log.warn("{} rejected: {}", action, e.getError());
            return LedgerResponses.rejected(e);
        } catch (IllegalArgumentException | ArithmeticException e) {
            return LedgerResponses.invalidInput(e);
        } catch (Exception e) {
            log.error("Failed to apply {}", action, e);
            return LedgerResponses.failed(action + " failed", e);
        }
    }

    @Data
    public static class UpdaterRequest {
        @NotBlank
        private String updater;
        private boolean authorized;
    }

    @Data
    public static class ValueRequest {
        @Min(0)
        private long value;
    }

    @Data
    public static class AddressRequest {
        @NotBlank
        private String address;
    }

    @Data
    public static class RevokeRequest {
        @NotBlank
        private String reason;
    }

}
