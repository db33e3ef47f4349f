package com.changesentinel.service.runtime;

import com.changesentinel.core.events.AlertRaised;
import com.changesentinel.core.model.MonitorTask;
import com.changesentinel.pipeline.TaskPipeline;
import com.changesentinel.pipeline.api.CheckResult;
import com.changesentinel.pipeline.api.PipelineContext;
import com.changesentinel.service.store.SnapshotCoordinator;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final TaskPipeline pipeline;
    private final PipelineContext context;
    private final SnapshotCoordinator coordinator;
    private final Duration tickInterval;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService pipelineExecutor;
    private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();

    public SchedulerService(
            TaskPipeline pipeline,
            PipelineContext context,
            SnapshotCoordinator coordinator,
            Duration tickInterval,
            int maxConcurrency
    ) {
        this.pipeline = pipeline;
        this.context = context;
        this.coordinator = coordinator;
        this.tickInterval = tickInterval;
        this.pipelineExecutor = Executors.newFixedThreadPool(maxConcurrency);
    }

    public void start() {
        timerExecutor.scheduleWithFixedDelay(this::safeTick, 0, tickInterval.toMillis(), TimeUnit.MILLISECONDS);
        LOGGER.info("Scheduler started, tick every " + tickInterval.toMillis() + "ms");
    }

    public List<CompletableFuture<CheckResult>> tick() {
        coordinator.commitIfDirty();
        Instant now = context.clock().instant();
        List<CompletableFuture<CheckResult>> submitted = new ArrayList<>();
        for (MonitorTask task : context.tasks().list()) {
            if (task.dueAt(now)) {
                submitted.add(submit(task.id(), false));
            }
        }
        return submitted;
    }

    public CheckResult checkNow(String taskId) {
        try {
            return submit(taskId, true).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    public boolean cancel(String taskId, Duration wait) {
        InFlight run = inFlight.get(taskId);
        if (run == null) {
            return false;
        }
        run.work.cancel(true);
        if (run.started.compareAndSet(false, true)) {
            inFlight.remove(taskId, run);
            run.result.complete(CheckResult.skipped(taskId, "Check cancelled"));
            return true;
        }
        try {
            run.result.get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            LOGGER.warning("Cancelled check for " + taskId + " did not finish cleanly: " + e);
        }
        LOGGER.info("Cancelled in-flight check for " + taskId);
        return true;
    }

    public boolean isRunning(String taskId) {
        return inFlight.containsKey(taskId);
    }

    public void shutdown() {
        timerExecutor.shutdown();
        pipelineExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            if (!pipelineExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                pipelineExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pipelineExecutor.shutdownNow();
        }
        LOGGER.info("Scheduler stopped");
    }

    private CompletableFuture<CheckResult> submit(String taskId, boolean force) {
        InFlight fresh = new InFlight(taskId, force);
        InFlight existing = inFlight.putIfAbsent(taskId, fresh);
        if (existing != null) {
            LOGGER.fine(() -> "Check for " + taskId + " already in flight; joining it");
            return existing.result;
        }
        try {
            pipelineExecutor.execute(fresh.work);
        } catch (RejectedExecutionException e) {
            inFlight.remove(taskId, fresh);
            fresh.result.completeExceptionally(e);
        }
        return fresh.result;
    }

    private void runTracked(String taskId, InFlight run, boolean force) {
        if (!run.started.compareAndSet(false, true)) {
            return;
        }
        CheckResult result;
        try {
            result = force || isStillDue(taskId)
                    ? pipeline.run(taskId, context)
                    : CheckResult.skipped(taskId, "Not due");
        } catch (RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Pipeline failed for task " + taskId, ex);
            context.eventBus().publish(new AlertRaised(
                    context.clock().instant(),
                    "scheduler",
                    "Pipeline failed for task " + taskId + ": " + ex.getMessage(),
                    Map.of("taskId", taskId)
            ));
            result = CheckResult.failed(taskId, String.valueOf(ex.getMessage()), false);
        } catch (Error error) {
            inFlight.remove(taskId, run);
            run.result.completeExceptionally(error);
            throw error;
        }
        inFlight.remove(taskId, run);
        run.result.complete(result);
    }

    private boolean isStillDue(String taskId) {
        Instant now = context.clock().instant();
        return context.tasks().find(taskId).map(task -> task.dueAt(now)).orElse(false);
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Scheduler tick failed", ex);
        }
    }

    private final class InFlight {
        private final CompletableFuture<CheckResult> result = new CompletableFuture<>();
        private final AtomicBoolean started = new AtomicBoolean();
        private final FutureTask<Void> work;

        private InFlight(String taskId, boolean force) {
            this.work = new FutureTask<>(() -> runTracked(taskId, this, force), null);
        }
    }
}
