package com.silentrisk.vault.controller;

import com.silentrisk.vault.service.ledger.LedgerError;
import com.silentrisk.vault.service.ledger.LedgerException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error bodies shared by the ledger controllers: {@code {"error": ..., "message": ...}}.
 */
final class LedgerResponses {

    private LedgerResponses() {
    }

    static ResponseEntity<Map<String, String>> rejected(LedgerException e) {
        return ResponseEntity.status(statusOf(e.getError())).body(body(e.getError().name(), e.getMessage()));
    }

    static ResponseEntity<Map<String, String>> invalidInput(RuntimeException e) {
        return ResponseEntity.badRequest().body(body("INVALID_ARGUMENT", e.getMessage()));
    }

    static ResponseEntity<Map<String, String>> failed(String message, Exception e) {
        return ResponseEntity.internalServerError().body(body("INTERNAL_ERROR", message + ": " + e.getMessage()));
    }

    static HttpStatus statusOf(LedgerError error) {
        return switch (error.getCategory()) {
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case THROTTLING -> HttpStatus.TOO_MANY_REQUESTS;
            case REPLAY, LIFECYCLE -> HttpStatus.CONFLICT;
            case INPUT, FRESHNESS, CRYPTOGRAPHIC -> HttpStatus.BAD_REQUEST;
        };
    }

    private static Map<String, String> body(String error, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }

}
