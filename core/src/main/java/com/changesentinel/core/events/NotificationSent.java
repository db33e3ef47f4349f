package com.changesentinel.core.events;

import com.changesentinel.core.model.NotificationKind;

import java.time.Instant;

public record NotificationSent(
        Instant timestamp,
        String taskId,
        String destination,
        NotificationKind kind
) implements Event {
    @Override
    public String type() {
        return "NotificationSent";
    }
}
