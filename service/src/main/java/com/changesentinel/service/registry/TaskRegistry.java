package com.changesentinel.service.registry;

import com.changesentinel.core.error.ConfigException;
import com.changesentinel.core.model.MonitorMode;
import com.changesentinel.core.model.MonitorTask;
import com.changesentinel.pipeline.api.TaskStore;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

public class TaskRegistry implements TaskStore {
    private static final int MAX_ID_ATTEMPTS = 32;

    private final Map<String, MonitorTask> tasks = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private final Duration minInterval;
    private final Supplier<String> idGenerator;

    public TaskRegistry(Clock clock, Duration minInterval) {
        this(clock, minInterval, () -> UUID.randomUUID().toString().substring(0, 8));
    }

    public TaskRegistry(Clock clock, Duration minInterval, Supplier<String> idGenerator) {
        this.clock = clock;
        this.minInterval = minInterval;
        this.idGenerator = idGenerator;
    }

    public MonitorTask register(String url, MonitorMode mode, Duration interval, String destination) {
        String normalizedUrl = validateUrl(url);
        if (mode == null) {
            throw new ConfigException("Monitor mode is required");
        }
        if (interval == null || interval.compareTo(minInterval) < 0) {
            throw new ConfigException("Interval " + (interval == null ? "(none)" : interval.toSeconds() + "s")
                    + " is below the minimum of " + minInterval.toSeconds() + "s");
        }
        if (destination == null || destination.isBlank()) {
            throw new ConfigException("Destination is required");
        }

        lock.writeLock().lock();
        try {
            MonitorTask task = MonitorTask.create(
                    uniqueId(), normalizedUrl, mode, interval, destination.trim(), clock.instant());
            tasks.put(task.id(), task);
            return task;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<MonitorTask> find(String taskId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(tasks.get(taskId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<MonitorTask> list() {
        lock.readLock().lock();
        try {
            return List.copyOf(tasks.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<MonitorTask> update(String taskId, UnaryOperator<MonitorTask> change) {
        lock.writeLock().lock();
        try {
            MonitorTask current = tasks.get(taskId);
            if (current == null) {
                return Optional.empty();
            }
            MonitorTask next = change.apply(current);
            if (!next.id().equals(taskId)) {
                throw new IllegalArgumentException("Task id is immutable: " + taskId + " -> " + next.id());
            }
            tasks.put(taskId, next);
            return Optional.of(next);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<MonitorTask> remove(String taskId) {
        lock.writeLock().lock();
        try {
            return Optional.ofNullable(tasks.remove(taskId));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void restore(MonitorTask task) {
        lock.writeLock().lock();
        try {
            tasks.putIfAbsent(task.id(), task);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void replaceAll(Collection<MonitorTask> loaded) {
        lock.writeLock().lock();
        try {
            tasks.clear();
            for (MonitorTask task : loaded) {
                tasks.put(task.id(), task);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private String uniqueId() {
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            String candidate = idGenerator.get();
            if (candidate != null && !candidate.isBlank() && !tasks.containsKey(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Unable to allocate a unique task id after " + MAX_ID_ATTEMPTS + " attempts");
    }

    private static String validateUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new ConfigException("URL is required");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new ConfigException("Malformed URL '" + url + "': " + e.getReason());
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!uri.isAbsolute() || !(scheme.equals("http") || scheme.equals("https"))) {
            throw new ConfigException("URL must be absolute http(s): " + url);
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new ConfigException("URL has no host: " + url);
        }
        return uri.toString();
    }
}
