package com.silentrisk.vault.repository.vault;

import com.silentrisk.vault.model.ledger.Address;
import com.silentrisk.vault.model.vault.UpdaterState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryUpdaterStateRegistry implements UpdaterStateRegistry {

    private final Map<Address, UpdaterState> stateStore = new ConcurrentHashMap<>();

    @Override
    public void save(UpdaterState state) {
        stateStore.put(state.getAccount(), state.toBuilder().build());
    }

    @Override
    public UpdaterState load(Address account) {
        UpdaterState state = stateStore.get(account);
        return state == null ? null : state.toBuilder().build();
    }

    @Override
    public boolean exists(Address account) {
        return stateStore.containsKey(account);
    }

    @Override
    public List<UpdaterState> loadAll() {
        return stateStore.values().stream()
                .map(state -> state.toBuilder().build())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public void discard(Address account) {
        stateStore.remove(account);
    }

}
