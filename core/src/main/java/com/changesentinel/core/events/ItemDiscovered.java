package com.changesentinel.core.events;

import java.time.Instant;

public record ItemDiscovered(
        Instant timestamp,
        String taskId,
        String itemId,
        String title,
        String url
) implements Event {
    @Override
    public String type() {
        return "ItemDiscovered";
    }
}
