package com.changesentinel.pipeline.api;

import java.time.Duration;
import java.util.Objects;

public record PipelineSettings(Duration fetchTimeout, int degradedThreshold, DedupScope dedupScope) {
    public PipelineSettings {
        Objects.requireNonNull(fetchTimeout, "fetchTimeout is required");
        Objects.requireNonNull(dedupScope, "dedupScope is required");
        if (degradedThreshold < 0) {
            throw new IllegalArgumentException("degradedThreshold must not be negative");
        }
    }
}
