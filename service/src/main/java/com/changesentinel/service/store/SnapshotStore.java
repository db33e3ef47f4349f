package com.changesentinel.service.store;

public interface SnapshotStore {
    MonitorSnapshot load();

    void save(MonitorSnapshot snapshot);
}
