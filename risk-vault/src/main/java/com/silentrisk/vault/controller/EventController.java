package com.silentrisk.vault.controller;

import com.silentrisk.vault.model.event.EventRecord;
import com.silentrisk.vault.service.ledger.EventLog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
@Tag(name = "Events", description = "Committed ledger events in emission order")
public class EventController {

    private final EventLog eventLog;

    @Operation(summary = "List committed events, optionally by name or from a sequence number on")
    @GetMapping
    public ResponseEntity<List<EventRecord>> listEvents(@RequestParam(required = false) String name,
                                                        @RequestParam(required = false) Long since) {
        List<EventRecord> events = since != null ? eventLog.since(since) : eventLog.all();
        if (name != null && !name.isBlank()) {
            events = events.stream().filter(event -> name.equals(event.getName())).toList();
        }
        log.info("Listing {} events (name={}, since={})", events.size(), name, since);
        return ResponseEntity.ok(events);
    }

}
