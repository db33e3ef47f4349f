package com.changesentinel.pipeline;

import com.changesentinel.core.error.ContentParseException;
import com.changesentinel.core.error.FetchException;
import com.changesentinel.core.error.PersistenceException;
import com.changesentinel.core.events.ContentChanged;
import com.changesentinel.core.events.ItemDiscovered;
import com.changesentinel.core.events.TaskChecked;
import com.changesentinel.core.events.TaskDegraded;
import com.changesentinel.core.model.CheckOutcome;
import com.changesentinel.core.model.Fingerprint;
import com.changesentinel.core.model.ListItem;
import com.changesentinel.core.model.MonitorMode;
import com.changesentinel.core.model.MonitorTask;
import com.changesentinel.core.model.NotificationEvent;
import com.changesentinel.core.model.TaskStatus;
import com.changesentinel.pipeline.api.CheckResult;
import com.changesentinel.pipeline.api.DedupScope;
import com.changesentinel.pipeline.api.PipelineContext;
import com.changesentinel.pipeline.detect.ChangeDetector;
import com.changesentinel.pipeline.detect.Detection;
import com.changesentinel.pipeline.detect.ItemDetection;
import com.changesentinel.pipeline.notify.DeliveryResult;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

public class TaskPipeline {
    private static final Logger LOGGER = Logger.getLogger(TaskPipeline.class.getName());

    private final ChangeDetector detector;

    public TaskPipeline(ChangeDetector detector) {
        this.detector = detector;
    }

    public CheckResult run(String taskId, PipelineContext ctx) {
        Optional<MonitorTask> current = ctx.tasks().find(taskId);
        if (current.isEmpty()) {
            return CheckResult.skipped(taskId, "Task no longer registered");
        }
        MonitorTask task = current.get();
        Instant checkedAt = ctx.clock().instant();

        String content;
        try {
            content = ctx.fetcher().fetch(URI.create(task.url()), ctx.settings().fetchTimeout());
        } catch (FetchException ex) {
            if (Thread.currentThread().isInterrupted()) {
                return cancelled(taskId);
            }
            return recordFailure(task, checkedAt, describe(ex), ctx);
        }
        if (Thread.currentThread().isInterrupted()) {
            return cancelled(taskId);
        }

        try {
            return task.mode() == MonitorMode.LIST
                    ? applyItems(task, checkedAt, detector.detectItems(task, content), ctx)
                    : applyPage(task, checkedAt, detector.detect(task, content), ctx);
        } catch (ContentParseException ex) {
            return recordFailure(task, checkedAt, "Parse failure: " + ex.getMessage(), ctx);
        }
    }

    private CheckResult applyPage(MonitorTask task, Instant checkedAt, Detection detection, PipelineContext ctx) {
        AtomicBoolean rebaselined = new AtomicBoolean();
        Optional<MonitorTask> updated = recordSuccess(task, checkedAt, detection, rebaselined, ctx);
        if (updated.isEmpty()) {
            return CheckResult.skipped(task.id(), "Task removed during check");
        }
        if (rebaselined.get()) {
            return finish(task, checkedAt, CheckOutcome.BASELINE, List.of(), ctx);
        }

        List<NotificationEvent> events = new ArrayList<>();
        if (detection.outcome() == CheckOutcome.CHANGED) {
            Fingerprint previous = task.fingerprint();
            ctx.eventBus().publish(new ContentChanged(
                    ctx.clock().instant(),
                    task.id(),
                    task.url(),
                    previous.digest(),
                    detection.fingerprint().digest(),
                    detection.summary()
            ));
            events.add(NotificationEvent.contentChanged(
                    task.id(), task.url(), detection.title(), detection.summary(), checkedAt));
        }
        return finish(task, checkedAt, detection.outcome(), events, ctx);
    }

    private CheckResult applyItems(MonitorTask task, Instant checkedAt, ItemDetection detection, PipelineContext ctx) {
        Detection page = detection.detection();
        AtomicBoolean rebaselined = new AtomicBoolean();
        Optional<MonitorTask> updated = recordSuccess(task, checkedAt, page, rebaselined, ctx);
        if (updated.isEmpty()) {
            return CheckResult.skipped(task.id(), "Task removed during check");
        }

        DedupScope scope = ctx.settings().dedupScope();
        List<String> keys = detection.items().stream().map(item -> scope.key(task.id(), item.id())).toList();
        Set<String> fresh = new HashSet<>(ctx.dedupStore().claim(keys));
        if (page.outcome() == CheckOutcome.BASELINE || rebaselined.get()) {
            LOGGER.fine(() -> "Baseline for " + task.id() + " seeded " + fresh.size() + " items");
            return finish(task, checkedAt, CheckOutcome.BASELINE, List.of(), ctx);
        }

        List<NotificationEvent> events = new ArrayList<>();
        for (ListItem item : detection.items()) {
            if (!fresh.contains(scope.key(task.id(), item.id()))) {
                continue;
            }
            ctx.eventBus().publish(new ItemDiscovered(ctx.clock().instant(), task.id(), item.id(), item.title(), item.url()));
            events.add(NotificationEvent.newItem(task.id(), item, checkedAt));
        }
        CheckOutcome outcome = events.isEmpty() ? page.outcome() : CheckOutcome.CHANGED;
        return finish(task, checkedAt, outcome, events, ctx);
    }

    private static Optional<MonitorTask> recordSuccess(
            MonitorTask task,
            Instant checkedAt,
            Detection detection,
            AtomicBoolean rebaselined,
            PipelineContext ctx
    ) {
        return ctx.tasks().update(task.id(), t -> {
            // a fingerprint that moved during the fetch was rebaselined; store this one silently
            boolean stale = !Objects.equals(t.fingerprint(), task.fingerprint());
            rebaselined.set(stale);
            return t.recordSuccess(checkedAt, detection.fingerprint(), !stale && detection.outcome() == CheckOutcome.CHANGED);
        });
    }

    private CheckResult finish(
            MonitorTask task,
            Instant checkedAt,
            CheckOutcome outcome,
            List<NotificationEvent> detected,
            PipelineContext ctx
    ) {
        boolean committed = commit(ctx);
        publishChecked(task, checkedAt, outcome, ctx);

        List<NotificationEvent> delivered = new ArrayList<>();
        List<DeliveryResult> deliveries = new ArrayList<>();
        for (NotificationEvent event : detected) {
            Optional<NotificationEvent> enriched = ctx.enricher().enrich(event);
            if (enriched.isEmpty()) {
                continue;
            }
            delivered.add(enriched.get());
            deliveries.add(ctx.notifier().notify(enriched.get(), task.destination()));
        }
        LOGGER.fine(() -> "Checked " + task.id() + ": " + outcome + ", " + delivered.size() + " notifications");
        return new CheckResult(task.id(), outcome, delivered, deliveries, committed, null);
    }

    private CheckResult recordFailure(MonitorTask task, Instant checkedAt, String error, PipelineContext ctx) {
        Optional<MonitorTask> updated = ctx.tasks().update(task.id(), t -> t.recordFailure(checkedAt, error));
        if (updated.isEmpty()) {
            return CheckResult.skipped(task.id(), "Task removed during check");
        }
        MonitorTask failed = updated.get();
        int threshold = ctx.settings().degradedThreshold();
        LOGGER.warning("Check failed for " + task.id() + " (" + task.url() + "), "
                + failed.failureCount() + " consecutive failures: " + error);
        if (failed.status(threshold) == TaskStatus.DEGRADED && failed.failureCount() == threshold + 1) {
            LOGGER.warning("Task " + task.id() + " is degraded after " + failed.failureCount() + " consecutive failures");
            ctx.eventBus().publish(new TaskDegraded(ctx.clock().instant(), task.id(), task.url(), failed.failureCount()));
        }
        boolean committed = commit(ctx);
        publishChecked(task, checkedAt, CheckOutcome.FAILED, ctx);
        return CheckResult.failed(task.id(), error, committed);
    }

    private static boolean commit(PipelineContext ctx) {
        try {
            ctx.committer().commit();
            return true;
        } catch (PersistenceException ex) {
            // The committer already reported it and keeps the state dirty for the next tick.
            return false;
        }
    }

    private static void publishChecked(MonitorTask task, Instant checkedAt, CheckOutcome outcome, PipelineContext ctx) {
        long durationMillis = Duration.between(checkedAt, ctx.clock().instant()).toMillis();
        ctx.eventBus().publish(new TaskChecked(ctx.clock().instant(), task.id(), task.url(), outcome, durationMillis));
    }

    private static CheckResult cancelled(String taskId) {
        LOGGER.fine(() -> "Check for " + taskId + " was cancelled");
        return CheckResult.skipped(taskId, "Check cancelled");
    }

    private static String describe(FetchException ex) {
        return ex.kind() + ": " + ex.getMessage();
    }
}
