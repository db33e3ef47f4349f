package com.changesentinel.pipeline.api;

public enum DedupScope {
    GLOBAL,
    PER_TASK;

    public String key(String taskId, String itemId) {
        return this == GLOBAL ? itemId : taskId + "|" + itemId;
    }
}
