package com.changesentinel.core.events;

import java.time.Instant;

public record TaskDegraded(
        Instant timestamp,
        String taskId,
        String url,
        int failureCount
) implements Event {
    @Override
    public String type() {
        return "TaskDegraded";
    }
}
