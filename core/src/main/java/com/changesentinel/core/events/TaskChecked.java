package com.changesentinel.core.events;

import com.changesentinel.core.model.CheckOutcome;

import java.time.Instant;

public record TaskChecked(
        Instant timestamp,
        String taskId,
        String url,
        CheckOutcome outcome,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "TaskChecked";
    }
}
