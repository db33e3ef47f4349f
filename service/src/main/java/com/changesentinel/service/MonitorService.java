package com.changesentinel.service;

import com.changesentinel.core.error.PersistenceException;
import com.changesentinel.core.events.Event;
import com.changesentinel.core.model.DedupEntry;
import com.changesentinel.core.model.Fingerprint;
import com.changesentinel.core.model.MonitorMode;
import com.changesentinel.core.model.MonitorTask;
import com.changesentinel.pipeline.api.CheckResult;
import com.changesentinel.pipeline.dedup.InMemoryDedupStore;
import com.changesentinel.service.registry.TaskRegistry;
import com.changesentinel.service.runtime.SchedulerService;
import com.changesentinel.service.store.EventCodec;
import com.changesentinel.service.store.EventStore;
import com.changesentinel.service.store.SnapshotCoordinator;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

public class MonitorService {
    private static final Logger LOGGER = Logger.getLogger(MonitorService.class.getName());

    private final TaskRegistry registry;
    private final InMemoryDedupStore dedupStore;
    private final SnapshotCoordinator coordinator;
    private final SchedulerService scheduler;
    private final EventStore eventStore;
    private final int degradedThreshold;
    private final Duration cancelWait;

    public MonitorService(
            TaskRegistry registry,
            InMemoryDedupStore dedupStore,
            SnapshotCoordinator coordinator,
            SchedulerService scheduler,
            EventStore eventStore,
            int degradedThreshold,
            Duration cancelWait
    ) {
        this.registry = registry;
        this.dedupStore = dedupStore;
        this.coordinator = coordinator;
        this.scheduler = scheduler;
        this.eventStore = eventStore;
        this.degradedThreshold = degradedThreshold;
        this.cancelWait = cancelWait;
    }

    public void start() {
        coordinator.load();
        scheduler.start();
    }

    public void stop() {
        scheduler.shutdown();
    }

    public String add(String url, Duration interval, String destination) {
        return add(url, MonitorMode.PAGE, interval, destination);
    }

    public String add(String url, MonitorMode mode, Duration interval, String destination) {
        MonitorTask task = registry.register(url, mode, interval, destination);
        try {
            coordinator.commit();
        } catch (PersistenceException e) {
            registry.remove(task.id());
            throw e;
        }
        LOGGER.info("Added task " + task.id() + " (" + mode + ") for " + task.url() + " every "
                + interval.toSeconds() + "s -> " + task.destination());
        return task.id();
    }

    public void remove(String taskId) {
        requireTask(taskId);
        scheduler.cancel(taskId, cancelWait);
        MonitorTask removed = registry.remove(taskId).orElseThrow(() -> unknownTask(taskId));
        try {
            coordinator.commit();
        } catch (PersistenceException e) {
            registry.restore(removed);
            throw e;
        }
        LOGGER.info("Removed task " + taskId);
    }

    public void enable(String taskId) {
        setEnabled(taskId, true);
    }

    public void disable(String taskId) {
        setEnabled(taskId, false);
    }

    public List<TaskView> list() {
        return registry.list().stream().map(task -> TaskView.of(task, degradedThreshold)).toList();
    }

    public Optional<TaskView> find(String taskId) {
        return registry.find(taskId).map(task -> TaskView.of(task, degradedThreshold));
    }

    public CheckResult checkNow(String taskId) {
        requireTask(taskId);
        return scheduler.checkNow(taskId);
    }

    public void resetDedup() {
        List<DedupEntry> previous = dedupStore.entries();
        dedupStore.reset();
        try {
            coordinator.commit();
        } catch (PersistenceException e) {
            dedupStore.replaceAll(previous);
            throw e;
        }
        LOGGER.info("Dedup store reset, " + previous.size() + " entries cleared");
    }

    public void rebaseline(String taskId) {
        Fingerprint previous = requireTask(taskId).fingerprint();
        registry.update(taskId, task -> task.withFingerprint(null));
        try {
            coordinator.commit();
        } catch (PersistenceException e) {
            registry.update(taskId, task -> task.withFingerprint(previous));
            throw e;
        }
        LOGGER.info("Task " + taskId + " will re-baseline on its next check");
    }

    public boolean cancelCheck(String taskId) {
        requireTask(taskId);
        return scheduler.cancel(taskId, cancelWait);
    }

    public List<Event> events(Instant since, String type, int limit) {
        if (type != null && !EventCodec.isKnownType(type)) {
            throw new IllegalArgumentException("Unknown event type: " + type);
        }
        return eventStore.query(since == null ? Instant.EPOCH : since, Optional.ofNullable(type), limit);
    }

    private void setEnabled(String taskId, boolean enabled) {
        boolean before = requireTask(taskId).enabled();
        registry.update(taskId, task -> task.withEnabled(enabled));
        try {
            coordinator.commit();
        } catch (PersistenceException e) {
            registry.update(taskId, task -> task.withEnabled(before));
            throw e;
        }
        LOGGER.info((enabled ? "Enabled" : "Disabled") + " task " + taskId);
    }

    private MonitorTask requireTask(String taskId) {
        return registry.find(taskId).orElseThrow(() -> unknownTask(taskId));
    }

    private static IllegalArgumentException unknownTask(String taskId) {
        return new IllegalArgumentException("Unknown task: " + taskId);
    }
}
