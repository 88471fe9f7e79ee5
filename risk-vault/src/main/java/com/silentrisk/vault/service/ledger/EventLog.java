package com.silentrisk.vault.service.ledger;

import com.silentrisk.vault.model.event.EventRecord;
import com.silentrisk.vault.model.event.LedgerEvent;
import com.silentrisk.vault.model.ledger.Address;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only log of committed events. Events of rolled back transactions never reach it.
 */
@Slf4j
public class EventLog {

    private final List<EventRecord> records = new CopyOnWriteArrayList<>();

    synchronized void append(long timestamp, Address emitter, LedgerEvent event) {
        EventRecord record = new EventRecord(records.size(), timestamp, emitter, event.name(), event);
        records.add(record);
        log.info("Event #{} {} from {}: {}", record.getSequence(), record.getName(), emitter, event);
    }

    public List<EventRecord> all() {
        return new ArrayList<>(records);
    }

    public List<EventRecord> byName(String name) {
        return records.stream()
                .filter(r -> r.getName().equals(name))
                .collect(Collectors.toList());
    }

    public <T extends LedgerEvent> List<T> ofType(Class<T> type) {
        return records.stream()
                .map(EventRecord::getEvent)
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    public List<EventRecord> since(long sequence) {
        return records.stream()
                .filter(r -> r.getSequence() >= sequence)
                .collect(Collectors.toList());
    }

    public int size() {
        return records.size();
    }

}
