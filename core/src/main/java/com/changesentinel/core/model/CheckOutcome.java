package com.changesentinel.core.model;

public enum CheckOutcome {
    BASELINE,
    UNCHANGED,
    CHANGED,
    FAILED,
    SKIPPED
}
