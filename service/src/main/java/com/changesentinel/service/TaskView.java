package com.changesentinel.service;

import com.changesentinel.core.model.MonitorTask;
import com.changesentinel.core.model.TaskStatus;

import java.time.Instant;

public record TaskView(MonitorTask task, TaskStatus status, String statusLine, Instant nextDue) {
    static TaskView of(MonitorTask task, int degradedThreshold) {
        return new TaskView(
                task,
                task.status(degradedThreshold),
                task.statusLine(degradedThreshold),
                task.enabled() ? task.nextDue() : null
        );
    }
}
