package com.changesentinel.core.model;

public enum TaskStatus {
    PENDING,
    OK,
    DEGRADED,
    DISABLED
}
