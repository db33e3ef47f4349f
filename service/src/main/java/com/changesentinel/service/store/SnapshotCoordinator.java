package com.changesentinel.service.store;

import com.changesentinel.core.bus.EventBus;
import com.changesentinel.core.error.PersistenceException;
import com.changesentinel.core.events.AlertRaised;
import com.changesentinel.pipeline.api.StateCommitter;
import com.changesentinel.pipeline.dedup.InMemoryDedupStore;
import com.changesentinel.service.registry.TaskRegistry;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

public class SnapshotCoordinator implements StateCommitter {
    private static final Logger LOGGER = Logger.getLogger(SnapshotCoordinator.class.getName());

    private final TaskRegistry registry;
    private final InMemoryDedupStore dedupStore;
    private final SnapshotStore snapshotStore;
    private final EventBus eventBus;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean dirty;

    public SnapshotCoordinator(
            TaskRegistry registry,
            InMemoryDedupStore dedupStore,
            SnapshotStore snapshotStore,
            EventBus eventBus,
            Clock clock
    ) {
        this.registry = registry;
        this.dedupStore = dedupStore;
        this.snapshotStore = snapshotStore;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public MonitorSnapshot load() {
        lock.lock();
        try {
            MonitorSnapshot snapshot = snapshotStore.load();
            registry.replaceAll(snapshot.tasks().values());
            dedupStore.replaceAll(snapshot.dedup());
            dirty = false;
            LOGGER.info("Loaded snapshot with " + snapshot.tasks().size() + " tasks and "
                    + snapshot.dedup().size() + " seen items");
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void commit() {
        lock.lock();
        try {
            MonitorSnapshot snapshot = MonitorSnapshot.of(registry.list(), dedupStore.entries());
            snapshotStore.save(snapshot);
            if (dirty) {
                LOGGER.info("Pending snapshot committed");
            }
            dirty = false;
        } catch (PersistenceException e) {
            dirty = true;
            LOGGER.log(Level.SEVERE, "Snapshot commit failed; state is not durable until the next successful commit", e);
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    "persistence",
                    "Snapshot commit failed: " + e.getMessage(),
                    Map.of("retry", "next scheduler tick")
            ));
            throw e;
        } finally {
            lock.unlock();
        }
    }

    public boolean commitIfDirty() {
        if (!dirty) {
            return true;
        }
        try {
            commit();
            return true;
        } catch (PersistenceException e) {
            return false;
        }
    }

    public boolean isDirty() {
        return dirty;
    }
}
