package com.changesentinel.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record MonitorTask(
        String id,
        String url,
        MonitorMode mode,
        Duration interval,
        boolean enabled,
        Fingerprint fingerprint,
        Instant lastCheck,
        int failureCount,
        String destination,
        Instant createdAt,
        Instant lastChanged,
        String lastError
) {
    public MonitorTask {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(mode, "mode is required");
        Objects.requireNonNull(interval, "interval is required");
        Objects.requireNonNull(destination, "destination is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        if (failureCount < 0) {
            throw new IllegalArgumentException("failureCount must not be negative");
        }
    }

    public static MonitorTask create(
            String id,
            String url,
            MonitorMode mode,
            Duration interval,
            String destination,
            Instant createdAt
    ) {
        return new MonitorTask(id, url, mode, interval, true, null, null, 0, destination, createdAt, null, null);
    }

    public MonitorTask withEnabled(boolean value) {
        return new MonitorTask(id, url, mode, interval, value, fingerprint, lastCheck, failureCount,
                destination, createdAt, lastChanged, lastError);
    }

    public MonitorTask withFingerprint(Fingerprint value) {
        return new MonitorTask(id, url, mode, interval, enabled, value, lastCheck, failureCount,
                destination, createdAt, lastChanged, lastError);
    }

    public MonitorTask recordSuccess(Instant at, Fingerprint next, boolean changed) {
        return new MonitorTask(id, url, mode, interval, enabled, next, at, 0,
                destination, createdAt, changed ? at : lastChanged, null);
    }

    public MonitorTask recordFailure(Instant at, String error) {
        return new MonitorTask(id, url, mode, interval, enabled, fingerprint, at, failureCount + 1,
                destination, createdAt, lastChanged, error);
    }

    public Instant nextDue() {
        return lastCheck == null ? createdAt : lastCheck.plus(interval);
    }

    public boolean dueAt(Instant now) {
        return enabled && !now.isBefore(nextDue());
    }

    public TaskStatus status(int degradedThreshold) {
        if (!enabled) {
            return TaskStatus.DISABLED;
        }
        if (failureCount > degradedThreshold) {
            return TaskStatus.DEGRADED;
        }
        return lastCheck == null ? TaskStatus.PENDING : TaskStatus.OK;
    }

    public String statusLine(int degradedThreshold) {
        return switch (status(degradedThreshold)) {
            case DISABLED -> "disabled";
            case PENDING -> "pending first check";
            case DEGRADED -> "degraded, " + failureCount + " consecutive failures";
            case OK -> failureCount == 0 ? "ok" : "ok, " + failureCount + " consecutive failures";
        };
    }
}
