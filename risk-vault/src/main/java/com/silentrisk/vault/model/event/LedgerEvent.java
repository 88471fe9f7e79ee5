package com.silentrisk.vault.model.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Marker for events emitted by the vault and the passport registry.
 */
public interface LedgerEvent {

    @JsonIgnore
    default String name() {
        return getClass().getSimpleName();
    }

}
