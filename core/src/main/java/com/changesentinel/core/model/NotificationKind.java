package com.changesentinel.core.model;

public enum NotificationKind {
    CONTENT_CHANGED,
    NEW_ITEM
}
