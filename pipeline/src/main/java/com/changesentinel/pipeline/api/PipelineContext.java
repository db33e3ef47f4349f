package com.changesentinel.pipeline.api;

import com.changesentinel.core.bus.EventBus;
import com.changesentinel.pipeline.fetch.Fetcher;
import com.changesentinel.pipeline.notify.ClassificationEnricher;
import com.changesentinel.pipeline.notify.Notifier;

import java.time.Clock;
import java.util.Objects;

public record PipelineContext(
        TaskStore tasks,
        DedupStore dedupStore,
        Fetcher fetcher,
        Notifier notifier,
        ClassificationEnricher enricher,
        StateCommitter committer,
        EventBus eventBus,
        Clock clock,
        PipelineSettings settings
) {
    public PipelineContext {
        Objects.requireNonNull(tasks, "tasks is required");
        Objects.requireNonNull(dedupStore, "dedupStore is required");
        Objects.requireNonNull(fetcher, "fetcher is required");
        Objects.requireNonNull(notifier, "notifier is required");
        Objects.requireNonNull(enricher, "enricher is required");
        Objects.requireNonNull(committer, "committer is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(settings, "settings is required");
    }
}
