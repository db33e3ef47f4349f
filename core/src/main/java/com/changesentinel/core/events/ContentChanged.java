package com.changesentinel.core.events;

import java.time.Instant;

public record ContentChanged(
        Instant timestamp,
        String taskId,
        String url,
        String oldFingerprint,
        String newFingerprint,
        String summary
) implements Event {
    @Override
    public String type() {
        return "ContentChanged";
    }
}
