package com.changesentinel.pipeline;

import com.changesentinel.core.bus.EventBus;
import com.changesentinel.core.error.FetchTimeoutException;
import com.changesentinel.core.error.PersistenceException;
import com.changesentinel.core.events.ContentChanged;
import com.changesentinel.core.events.ItemDiscovered;
import com.changesentinel.core.events.TaskChecked;
import com.changesentinel.core.events.TaskDegraded;
import com.changesentinel.core.model.CheckOutcome;
import com.changesentinel.core.model.Classification;
import com.changesentinel.core.model.Fingerprint;
import com.changesentinel.core.model.MonitorMode;
import com.changesentinel.core.model.MonitorTask;
import com.changesentinel.core.model.NotificationKind;
import com.changesentinel.pipeline.api.CheckResult;
import com.changesentinel.pipeline.api.DedupScope;
import com.changesentinel.pipeline.api.PipelineContext;
import com.changesentinel.pipeline.api.PipelineSettings;
import com.changesentinel.pipeline.api.StateCommitter;
import com.changesentinel.pipeline.dedup.InMemoryDedupStore;
import com.changesentinel.pipeline.detect.ChangeDetector;
import com.changesentinel.pipeline.detect.ContentNormalizer;
import com.changesentinel.pipeline.detect.ItemExtractor;
import com.changesentinel.pipeline.detect.ListRules;
import com.changesentinel.pipeline.detect.NormalizationRules;
import com.changesentinel.pipeline.fetch.Fetcher;
import com.changesentinel.pipeline.fetch.RetryPolicy;
import com.changesentinel.pipeline.notify.ClassificationEnricher;
import com.changesentinel.pipeline.notify.MessageFormatter;
import com.changesentinel.pipeline.notify.Notifier;
import com.changesentinel.pipeline.support.EventCapture;
import com.changesentinel.pipeline.support.InMemoryTaskStore;
import com.changesentinel.pipeline.support.MutableClock;
import com.changesentinel.pipeline.support.RecordingTransport;
import com.changesentinel.pipeline.support.ScriptedRawFetcher;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskPipelineTest {
    private static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");
    private static final String PAGE_URL = "http://board.example.test/notices";

    private final MutableClock clock = new MutableClock(T0, ZoneOffset.UTC);
    private final EventBus bus = new EventBus((event, error) -> {
        throw new AssertionError("Unexpected handler error", error);
    });
    private final EventCapture capture = new EventCapture(bus);
    private final InMemoryTaskStore tasks = new InMemoryTaskStore();
    private final InMemoryDedupStore dedup = new InMemoryDedupStore(clock);
    private final RecordingTransport transport = new RecordingTransport();
    private final ScriptedRawFetcher raw = new ScriptedRawFetcher();
    private final AtomicInteger commits = new AtomicInteger();
    private final AtomicBoolean storageDown = new AtomicBoolean();
    private final List<String> order = new ArrayList<>();

    private final StateCommitter committer = () -> {
        if (storageDown.get()) {
            throw new PersistenceException("disk full", null);
        }
        commits.incrementAndGet();
        order.add("commit");
    };

    private final TaskPipeline pipeline = new TaskPipeline(new ChangeDetector(
            new ContentNormalizer(NormalizationRules.defaults()),
            new ItemExtractor(ListRules.defaults())
    ));

    @Test
    void pageLifecycleFromBaselineThroughFailure() {
        MonitorTask task = tasks.put(MonitorTask.create("T", PAGE_URL, MonitorMode.PAGE, Duration.ofSeconds(300), "chat-1", T0));
        PipelineContext ctx = context(ClassificationEnricher.disabled());
        raw.thenReturn(page("first notice"))
                .thenReturn(page("first notice"))
                .thenReturn(page("second notice"))
                .thenThrow(new FetchTimeoutException(PAGE_URL, null));

        CheckResult baseline = pipeline.run(task.id(), ctx);
        Fingerprint f0 = tasks.find("T").orElseThrow().fingerprint();
        assertEquals(CheckOutcome.BASELINE, baseline.outcome());
        assertTrue(baseline.events().isEmpty());
        assertEquals(T0, tasks.find("T").orElseThrow().lastCheck());

        clock.setInstant(T0.plusSeconds(300));
        assertTrue(tasks.find("T").orElseThrow().dueAt(clock.instant()));
        CheckResult unchanged = pipeline.run(task.id(), ctx);
        assertEquals(CheckOutcome.UNCHANGED, unchanged.outcome());
        assertTrue(unchanged.events().isEmpty());
        assertEquals(f0, tasks.find("T").orElseThrow().fingerprint());

        clock.setInstant(T0.plusSeconds(600));
        CheckResult changed = pipeline.run(task.id(), ctx);
        Fingerprint f1 = tasks.find("T").orElseThrow().fingerprint();
        assertEquals(CheckOutcome.CHANGED, changed.outcome());
        assertEquals(1, changed.events().size());
        assertEquals("Board: second notice", changed.events().get(0).summary());
        assertFalse(f0.sameContentAs(f1));
        assertEquals(1, transport.deliveries().size());
        assertEquals(1, capture.byType(ContentChanged.class).size());

        clock.setInstant(T0.plusSeconds(900));
        CheckResult failed = pipeline.run(task.id(), ctx);
        MonitorTask afterFailure = tasks.find("T").orElseThrow();
        assertEquals(CheckOutcome.FAILED, failed.outcome());
        assertTrue(failed.events().isEmpty());
        assertEquals(1, afterFailure.failureCount());
        assertEquals(f1, afterFailure.fingerprint());
        assertTrue(afterFailure.lastError().startsWith("TIMEOUT"));
        assertEquals(1, transport.deliveries().size());
        assertEquals(4, capture.byType(TaskChecked.class).size());
        assertEquals(4, commits.get());
    }

    @Test
    void stateIsCommittedBeforeDelivery() {
        MonitorTask task = tasks.put(MonitorTask.create("T", PAGE_URL, MonitorMode.PAGE, Duration.ofSeconds(300), "chat-1", T0)
                .withFingerprint(new Fingerprint("0".repeat(64), null)));
        PipelineContext ctx = new PipelineContext(tasks, dedup, new Fetcher(raw, RetryPolicy.none()),
                new Notifier((destination, message) -> order.add("deliver"), new MessageFormatter(ZoneOffset.UTC), bus, clock),
                ClassificationEnricher.disabled(), committer, bus, clock, settings(DedupScope.GLOBAL));
        raw.thenReturn(page("fresh"));

        pipeline.run(task.id(), ctx);

        assertEquals(List.of("commit", "deliver"), order);
    }

    @Test
    void listBaselineIsSilentAndLaterItemsArriveInPageOrder() {
        MonitorTask task = tasks.put(MonitorTask.create("L", PAGE_URL, MonitorMode.LIST, Duration.ofSeconds(300), "chat-1", T0));
        PipelineContext ctx = context(ClassificationEnricher.disabled());
        raw.thenReturn(listing("a", "b"))
                .thenReturn(listing("d", "c", "a", "b"))
                .thenReturn(listing("d", "c", "a", "b"));

        CheckResult baseline = pipeline.run(task.id(), ctx);
        assertEquals(CheckOutcome.BASELINE, baseline.outcome());
        assertTrue(dedup.seen("http://board.example.test/n/a"));
        assertTrue(transport.deliveries().isEmpty());

        clock.setInstant(T0.plusSeconds(300));
        CheckResult grown = pipeline.run(task.id(), ctx);
        assertEquals(CheckOutcome.CHANGED, grown.outcome());
        assertEquals(List.of("Notice d", "Notice c"), grown.events().stream().map(e -> e.title()).toList());
        assertEquals(NotificationKind.NEW_ITEM, grown.events().get(0).kind());
        assertEquals(2, capture.byType(ItemDiscovered.class).size());
        assertTrue(grown.allDelivered());

        clock.setInstant(T0.plusSeconds(600));
        CheckResult repeat = pipeline.run(task.id(), ctx);
        assertEquals(CheckOutcome.UNCHANGED, repeat.outcome());
        assertTrue(repeat.events().isEmpty());
    }

    @Test
    void resetDedupMakesListedItemsNewAgain() {
        MonitorTask task = tasks.put(MonitorTask.create("L", PAGE_URL, MonitorMode.LIST, Duration.ofSeconds(300), "chat-1", T0));
        PipelineContext ctx = context(ClassificationEnricher.disabled());
        raw.thenReturn(listing("a", "b"));
        pipeline.run(task.id(), ctx);

        dedup.reset();
        CheckResult afterReset = pipeline.run(task.id(), ctx);

        assertEquals(2, afterReset.events().size());
    }

    @Test
    void perTaskScopeKeepsTasksIndependent() {
        tasks.put(MonitorTask.create("L1", PAGE_URL, MonitorMode.LIST, Duration.ofSeconds(300), "chat-1", T0));
        tasks.put(MonitorTask.create("L2", PAGE_URL, MonitorMode.LIST, Duration.ofSeconds(300), "chat-2", T0));
        PipelineContext ctx = new PipelineContext(tasks, dedup, new Fetcher(raw, RetryPolicy.none()),
                new Notifier(transport, new MessageFormatter(ZoneOffset.UTC), bus, clock),
                ClassificationEnricher.disabled(), committer, bus, clock, settings(DedupScope.PER_TASK));
        raw.thenReturn(listing("a"));

        pipeline.run("L1", ctx);
        pipeline.run("L2", ctx);

        assertTrue(dedup.seen("L1|http://board.example.test/n/a"));
        assertTrue(dedup.seen("L2|http://board.example.test/n/a"));
    }

    @Test
    void irrelevantItemsAreMarkedButNotDelivered() {
        MonitorTask task = tasks.put(MonitorTask.create("L", PAGE_URL, MonitorMode.LIST, Duration.ofSeconds(300), "chat-1", T0));
        ClassificationEnricher enricher = ClassificationEnricher.enabled(
                (title, content) -> new Classification(title.endsWith("keep"), null, null),
                new Fetcher(new ScriptedRawFetcher().thenReturn("<body>detail</body>"), RetryPolicy.none()),
                Duration.ofSeconds(1));
        PipelineContext ctx = context(enricher);
        raw.thenReturn(listing("a")).thenReturn(listing("keep", "drop", "a"));

        pipeline.run(task.id(), ctx);
        CheckResult result = pipeline.run(task.id(), ctx);

        assertEquals(1, result.events().size());
        assertEquals("Notice keep", result.events().get(0).title());
        assertTrue(dedup.seen("http://board.example.test/n/drop"));
    }

    @Test
    void degradedIsAnnouncedOnceWhenThresholdIsCrossed() {
        MonitorTask task = tasks.put(MonitorTask.create("T", PAGE_URL, MonitorMode.PAGE, Duration.ofSeconds(300), "chat-1", T0));
        PipelineContext ctx = context(ClassificationEnricher.disabled());
        raw.thenThrow(new FetchTimeoutException(PAGE_URL, null));

        for (int i = 0; i < 6; i++) {
            pipeline.run(task.id(), ctx);
        }

        MonitorTask degraded = tasks.find("T").orElseThrow();
        assertEquals(6, degraded.failureCount());
        assertEquals("degraded, 6 consecutive failures", degraded.statusLine(3));
        assertEquals(1, capture.byType(TaskDegraded.class).size());
        assertEquals(4, capture.byType(TaskDegraded.class).get(0).failureCount());
        assertTrue(degraded.enabled());
    }

    @Test
    void successClearsFailureStreak() {
        MonitorTask task = tasks.put(MonitorTask.create("T", PAGE_URL, MonitorMode.PAGE, Duration.ofSeconds(300), "chat-1", T0));
        PipelineContext ctx = context(ClassificationEnricher.disabled());
        raw.thenThrow(new FetchTimeoutException(PAGE_URL, null)).thenReturn(page("ok"));

        pipeline.run(task.id(), ctx);
        pipeline.run(task.id(), ctx);

        MonitorTask recovered = tasks.find("T").orElseThrow();
        assertEquals(0, recovered.failureCount());
        assertNull(recovered.lastError());
    }

    @Test
    void persistenceFailureIsReportedAndNotificationsStillAttempted() {
        MonitorTask task = tasks.put(MonitorTask.create("T", PAGE_URL, MonitorMode.PAGE, Duration.ofSeconds(300), "chat-1", T0)
                .withFingerprint(new Fingerprint("0".repeat(64), null)));
        PipelineContext ctx = context(ClassificationEnricher.disabled());
        raw.thenReturn(page("changed"));
        storageDown.set(true);

        CheckResult result = pipeline.run(task.id(), ctx);

        assertFalse(result.committed());
        assertEquals(CheckOutcome.CHANGED, result.outcome());
        assertEquals(1, transport.deliveries().size());
    }

    @Test
    void failedDeliveryDoesNotUndoState() {
        MonitorTask task = tasks.put(MonitorTask.create("T", PAGE_URL, MonitorMode.PAGE, Duration.ofSeconds(300), "chat-1", T0)
                .withFingerprint(new Fingerprint("0".repeat(64), null)));
        PipelineContext ctx = context(ClassificationEnricher.disabled());
        raw.thenReturn(page("changed"));
        transport.failWith(true);

        CheckResult result = pipeline.run(task.id(), ctx);

        assertFalse(result.allDelivered());
        assertFalse(tasks.find("T").orElseThrow().fingerprint().digest().startsWith("0000"));
        assertEquals(1, commits.get());
    }

    @Test
    void removedTaskIsSkipped() {
        CheckResult result = pipeline.run("missing", context(ClassificationEnricher.disabled()));

        assertEquals(CheckOutcome.SKIPPED, result.outcome());
        assertEquals(0, raw.calls());
    }

    @Test
    void taskRemovedMidFetchIsNotResurrected() {
        MonitorTask task = tasks.put(MonitorTask.create("T", PAGE_URL, MonitorMode.PAGE, Duration.ofSeconds(300), "chat-1", T0));
        Fetcher removingFetcher = new Fetcher((uri, timeout) -> {
            tasks.remove("T");
            return page("late");
        }, RetryPolicy.none());
        PipelineContext ctx = new PipelineContext(tasks, dedup, removingFetcher,
                new Notifier(transport, new MessageFormatter(ZoneOffset.UTC), bus, clock),
                ClassificationEnricher.disabled(), committer, bus, clock, settings(DedupScope.GLOBAL));

        CheckResult result = pipeline.run(task.id(), ctx);

        assertEquals(CheckOutcome.SKIPPED, result.outcome());
        assertTrue(tasks.find("T").isEmpty());
        assertEquals(0, commits.get());
    }

    @Test
    void rebaselineDuringFetchTurnsChangeIntoSilentBaseline() {
        MonitorTask task = tasks.put(MonitorTask.create("T", PAGE_URL, MonitorMode.PAGE, Duration.ofSeconds(300), "chat-1", T0)
                .withFingerprint(new Fingerprint("0".repeat(64), null)));
        Fetcher rebaseliningFetcher = new Fetcher((uri, timeout) -> {
            tasks.update("T", t -> t.withFingerprint(null));
            return page("moved on");
        }, RetryPolicy.none());
        PipelineContext ctx = new PipelineContext(tasks, dedup, rebaseliningFetcher,
                new Notifier(transport, new MessageFormatter(ZoneOffset.UTC), bus, clock),
                ClassificationEnricher.disabled(), committer, bus, clock, settings(DedupScope.GLOBAL));

        CheckResult result = pipeline.run(task.id(), ctx);

        MonitorTask after = tasks.find("T").orElseThrow();
        assertEquals(CheckOutcome.BASELINE, result.outcome());
        assertTrue(result.events().isEmpty());
        assertTrue(transport.deliveries().isEmpty());
        assertTrue(capture.byType(ContentChanged.class).isEmpty());
        assertFalse(after.fingerprint().digest().startsWith("0000"));
        assertNull(after.lastChanged());
        assertEquals(1, commits.get());
    }

    @Test
    void rebaselineDuringListFetchSeedsItemsSilently() {
        tasks.put(MonitorTask.create("L", PAGE_URL, MonitorMode.LIST, Duration.ofSeconds(300), "chat-1", T0));
        PipelineContext ctx = context(ClassificationEnricher.disabled());
        raw.thenReturn(listing("a"));
        pipeline.run("L", ctx);

        Fetcher rebaseliningFetcher = new Fetcher((uri, timeout) -> {
            tasks.update("L", t -> t.withFingerprint(null));
            return listing("b", "a");
        }, RetryPolicy.none());
        PipelineContext racing = new PipelineContext(tasks, dedup, rebaseliningFetcher,
                new Notifier(transport, new MessageFormatter(ZoneOffset.UTC), bus, clock),
                ClassificationEnricher.disabled(), committer, bus, clock, settings(DedupScope.GLOBAL));

        CheckResult result = pipeline.run("L", racing);

        assertEquals(CheckOutcome.BASELINE, result.outcome());
        assertTrue(result.events().isEmpty());
        assertTrue(capture.byType(ItemDiscovered.class).isEmpty());
        assertTrue(dedup.seen("http://board.example.test/n/b"));
    }

    private PipelineContext context(ClassificationEnricher enricher) {
        return new PipelineContext(
                tasks,
                dedup,
                new Fetcher(raw, RetryPolicy.none()),
                new Notifier(transport, new MessageFormatter(ZoneOffset.UTC), bus, clock),
                enricher,
                committer,
                bus,
                clock,
                settings(DedupScope.GLOBAL)
        );
    }

    private static PipelineSettings settings(DedupScope scope) {
        return new PipelineSettings(Duration.ofSeconds(5), 3, scope);
    }

    private static String page(String text) {
        return "<html><head><title>Board</title></head><body><script>var now = Date.now();</script><p>" + text + "</p></body></html>";
    }

    private static String listing(String... slugs) {
        StringBuilder html = new StringBuilder("<html><body><ul class='list'>");
        for (String slug : slugs) {
            html.append("<li><a href='/n/").append(slug).append("'>Notice ").append(slug).append("</a><span>2026-03-01</span></li>");
        }
        return html.append("</ul></body></html>").toString();
    }
}
