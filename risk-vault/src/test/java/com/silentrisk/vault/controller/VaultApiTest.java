package com.silentrisk.vault.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.silentrisk.vault.model.ledger.Bytes32;
import com.silentrisk.vault.service.crypto.PlaintextScoreEvaluator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.silentrisk.vault.support.VaultFixture.hash;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class VaultApiTest {

    private static final String CALLER = "X-Caller-Address";
    private static final String OWNER = "0x00000000000000000000000000000000000000a1";
    private static final String UPDATER = "0x00000000000000000000000000000000000000b1";
    private static final String STRANGER = "0x00000000000000000000000000000000000000c1";
    private static final String USER = "0x00000000000000000000000000000000000000d1";
    private static final String DAO = "0x00000000000000000000000000000000000000e1";
    private static final String PROOF = "0x" + "ab".repeat(64);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private Map<String, Object> submission(String label, int score) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("commitment", commitment(label));
        body.put("encryptedScore", PlaintextScoreEvaluator.encode(score).toHex());
        body.put("scoreProof", PROOF);
        body.put("blockHeight", 12345);
        body.put("nullifierHash", hash("nullifier-" + label).toHex());
        body.put("addressProof", PROOF);
        body.put("recipient", USER);
        return body;
    }

    private static String commitment(String label) {
        return hash("commitment-" + label).toHex();
    }

    private ResultActions submit(String caller, Map<String, Object> body) throws Exception {
        return mockMvc.perform(post("/api/vault/submissions")
                .header(CALLER, caller)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)));
    }

    private ResultActions thresholdQuery(String caller, String commitment, int threshold) throws Exception {
        Map<String, Object> body = Map.of(
                "commitment", commitment,
                "threshold", PlaintextScoreEvaluator.encode(threshold).toHex(),
                "proof", PROOF);
        return mockMvc.perform(post("/api/vault/threshold")
                .header(CALLER, caller)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)));
    }

    @Test
    void submissionMintsPassportAndAnswersThresholdQueries() throws Exception {
        submit(UPDATER, submission("alice", 2500))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.band").value("LOW"))
                .andExpect(jsonPath("$.passportTokenId").value(0));

        mockMvc.perform(get("/api/vault/commitments/{commitment}/band", commitment("alice")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.band").value("LOW"));
        mockMvc.perform(get("/api/vault/commitments/{commitment}/validity", commitment("alice")))
                .andExpect(jsonPath("$.exists").value(true))
                .andExpect(jsonPath("$.valid").value(true));
        mockMvc.perform(get("/api/passport/0/holder"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.holder").value(USER));
        mockMvc.perform(get("/api/passport/0/validity"))
                .andExpect(jsonPath("$.valid").value(true));

        thresholdQuery(DAO, commitment("alice"), 3000)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.belowThreshold").value(true));
        thresholdQuery(DAO, commitment("alice"), 2500)
                .andExpect(jsonPath("$.belowThreshold").value(false));
    }

    @Test
    void ledgerErrorsMapToHttpStatus() throws Exception {
        submit(STRANGER, submission("alice", 2500))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("NOT_AUTHORIZED"));

        submit(UPDATER, submission("alice", 2500)).andExpect(status().isOk());
        Map<String, Object> replay = submission("bob", 4000);
        replay.put("nullifierHash", hash("nullifier-alice").toHex());
        submit(UPDATER, replay)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("NULLIFIER_ALREADY_USED"));

        Map<String, Object> shortProof = submission("carol", 4000);
        shortProof.put("scoreProof", "0xabcd");
        submit(UPDATER, shortProof)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_PROOF"));

        mockMvc.perform(get("/api/passport/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("PASSPORT_NOT_FOUND"));

        thresholdQuery(DAO, hash("unknown").toHex(), 3000)
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("COMMITMENT_NOT_FOUND"));
    }

    @Test
    void malformedInputIsRejected() throws Exception {
        Map<String, Object> malformed = submission("alice", 2500);
        malformed.put("commitment", "0x1234");
        submit(UPDATER, malformed)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_ARGUMENT"));

        mockMvc.perform(get("/api/vault/commitments/{commitment}/band", "not-hex"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void adminOperationsAreOwnerOnly() throws Exception {
        mockMvc.perform(post("/api/admin/vault/pause").header(CALLER, STRANGER))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("NOT_AUTHORIZED"));

        mockMvc.perform(post("/api/admin/vault/pause").header(CALLER, OWNER))
                .andExpect(status().isOk());
        submit(UPDATER, submission("alice", 2500))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("CONTRACT_PAUSED"));
        mockMvc.perform(get("/api/vault/info"))
                .andExpect(jsonPath("$.paused").value(true))
                .andExpect(jsonPath("$.owner").value(OWNER));

        mockMvc.perform(post("/api/admin/vault/unpause").header(CALLER, OWNER))
                .andExpect(status().isOk());
        submit(UPDATER, submission("alice", 2500)).andExpect(status().isOk());

        mockMvc.perform(post("/api/admin/passport/0/revoke")
                        .header(CALLER, STRANGER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"policy violation\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("OWNER_ONLY"));
        mockMvc.perform(post("/api/admin/passport/0/revoke")
                        .header(CALLER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"policy violation\"}"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/api/passport/0/validity"))
                .andExpect(jsonPath("$.valid").value(false));
    }

    @Test
    void decryptionQuotaIsReportedAsTooManyRequests() throws Exception {
        submit(UPDATER, submission("alice", 2500)).andExpect(status().isOk());
        mockMvc.perform(put("/api/admin/vault/max-daily-decryptions")
                        .header(CALLER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":1}"))
                .andExpect(status().isOk());

        thresholdQuery(DAO, commitment("alice"), 3000).andExpect(status().isOk());
        thresholdQuery(DAO, commitment("alice"), 3000)
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("DECRYPTION_LIMIT_EXCEEDED"));
    }

    @Test
    void passportCanBeTransferredByItsHolder() throws Exception {
        submit(UPDATER, submission("alice", 2500)).andExpect(status().isOk());

        mockMvc.perform(post("/api/passport/0/transfer")
                        .header(CALLER, USER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("from", USER, "to", DAO))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.owner").value(DAO))
                .andExpect(jsonPath("$.commitment").value(commitment("alice")));
        mockMvc.perform(get("/api/passport/holders/{holder}/balance", DAO))
                .andExpect(jsonPath("$.balance").value(1));
    }

    @Test
    void committedEventsAreListed() throws Exception {
        submit(UPDATER, submission("alice", 2500)).andExpect(status().isOk());

        mockMvc.perform(get("/api/events").param("name", "PassportMinted"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].event.tokenId").value(0))
                .andExpect(jsonPath("$[0].event.recipient").value(USER));
    }

    @Test
    void commitmentHelperDerivesVaultInputs() throws Exception {
        Bytes32 secret = hash("secret");

        mockMvc.perform(post("/api/vault/tools/commitment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("wallet", USER, "secret", secret.toHex()))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.secret").value(secret.toHex()))
                .andExpect(jsonPath("$.commitment").isString())
                .andExpect(jsonPath("$.nullifierHash").isString());

        mockMvc.perform(post("/api/vault/commitments/validity")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("commitments", List.of(commitment("x"))))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hasValidScore[0]").value(false))
                .andExpect(jsonPath("$.bands[0]").value("UNKNOWN"));
    }

}
