package com.changesentinel.service.store;

import com.changesentinel.core.error.PersistenceException;
import com.changesentinel.core.util.JsonUtils;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Optional;

public class KeyValueSnapshotStore implements SnapshotStore {
    static final String KEY = "snapshot";
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final KeyValueStore store;

    public KeyValueSnapshotStore(KeyValueStore store) {
        this.store = store;
    }

    @Override
    public MonitorSnapshot load() {
        Optional<byte[]> raw = store.get(KEY);
        if (raw.isEmpty()) {
            return MonitorSnapshot.empty();
        }
        MonitorSnapshot snapshot;
        try {
            snapshot = MAPPER.readValue(raw.get(), MonitorSnapshot.class);
        } catch (IOException e) {
            throw new PersistenceException("Snapshot is unreadable", e);
        }
        if (snapshot.version() != MonitorSnapshot.CURRENT_VERSION) {
            throw new PersistenceException("Unsupported snapshot version " + snapshot.version(), null);
        }
        return snapshot;
    }

    @Override
    public void save(MonitorSnapshot snapshot) {
        byte[] bytes;
        try {
            bytes = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(snapshot);
        } catch (IOException e) {
            throw new PersistenceException("Unable to serialize snapshot", e);
        }
        store.put(KEY, bytes);
    }
}
