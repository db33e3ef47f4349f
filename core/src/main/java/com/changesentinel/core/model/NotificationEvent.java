package com.changesentinel.core.model;

import java.time.Instant;
import java.util.Objects;

public record NotificationEvent(
        String taskId,
        NotificationKind kind,
        String title,
        String summary,
        String link,
        Instant timestamp,
        Classification classification
) {
    public NotificationEvent {
        Objects.requireNonNull(taskId, "taskId is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    public static NotificationEvent contentChanged(String taskId, String url, String title, String summary, Instant at) {
        return new NotificationEvent(taskId, NotificationKind.CONTENT_CHANGED, title, summary, url, at, null);
    }

    public static NotificationEvent newItem(String taskId, ListItem item, Instant at) {
        return new NotificationEvent(taskId, NotificationKind.NEW_ITEM, item.title(), item.postedAt(), item.url(), at, null);
    }

    public NotificationEvent withClassification(Classification value) {
        return new NotificationEvent(taskId, kind, title, summary, link, timestamp, value);
    }
}
