package com.changesentinel.service.store;

import com.changesentinel.core.model.DedupEntry;
import com.changesentinel.core.model.MonitorTask;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record MonitorSnapshot(int version, Map<String, MonitorTask> tasks, List<DedupEntry> dedup) {
    public static final int CURRENT_VERSION = 1;

    public MonitorSnapshot {
        tasks = tasks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
        dedup = dedup == null ? List.of() : List.copyOf(dedup);
    }

    public static MonitorSnapshot empty() {
        return new MonitorSnapshot(CURRENT_VERSION, Map.of(), List.of());
    }

    public static MonitorSnapshot of(List<MonitorTask> tasks, List<DedupEntry> dedup) {
        Map<String, MonitorTask> byId = new LinkedHashMap<>();
        for (MonitorTask task : tasks) {
            byId.put(task.id(), task);
        }
        return new MonitorSnapshot(CURRENT_VERSION, byId, dedup);
    }
}
