package com.changesentinel.core.events;

import java.time.Instant;

public record NotificationFailed(
        Instant timestamp,
        String taskId,
        String destination,
        String reason
) implements Event {
    @Override
    public String type() {
        return "NotificationFailed";
    }
}
