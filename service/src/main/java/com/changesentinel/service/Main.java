package com.changesentinel.service;

import com.changesentinel.core.bus.EventBus;
import com.changesentinel.core.model.MonitorTask;
import com.changesentinel.pipeline.TaskPipeline;
import com.changesentinel.pipeline.api.PipelineContext;
import com.changesentinel.pipeline.api.PipelineSettings;
import com.changesentinel.pipeline.dedup.InMemoryDedupStore;
import com.changesentinel.pipeline.detect.ChangeDetector;
import com.changesentinel.pipeline.detect.ContentNormalizer;
import com.changesentinel.pipeline.detect.ItemExtractor;
import com.changesentinel.pipeline.fetch.Fetcher;
import com.changesentinel.pipeline.fetch.HttpRawFetcher;
import com.changesentinel.pipeline.fetch.RenderedFetcher;
import com.changesentinel.pipeline.fetch.Sleeper;
import com.changesentinel.pipeline.notify.ClassificationEnricher;
import com.changesentinel.pipeline.notify.MessageFormatter;
import com.changesentinel.pipeline.notify.NotificationTransport;
import com.changesentinel.pipeline.notify.Notifier;
import com.changesentinel.service.classify.ChatCompletionClassifier;
import com.changesentinel.service.config.ConfigLoader;
import com.changesentinel.service.config.MonitorConfig;
import com.changesentinel.service.http.HttpClientFactory;
import com.changesentinel.service.notify.LogTransport;
import com.changesentinel.service.notify.WebhookTransport;
import com.changesentinel.service.registry.TaskRegistry;
import com.changesentinel.service.render.CommandRenderedFetcher;
import com.changesentinel.service.runtime.SchedulerService;
import com.changesentinel.service.store.EventCodec;
import com.changesentinel.service.store.EventStore;
import com.changesentinel.service.store.FileKeyValueStore;
import com.changesentinel.service.store.JsonlEventStore;
import com.changesentinel.service.store.KeyValueSnapshotStore;
import com.changesentinel.service.store.SnapshotCoordinator;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Map<String, String> env = System.getenv();
        Path configDir = Path.of(env.getOrDefault("CONFIG_DIR", "config"));
        Path stateDir = Path.of(env.getOrDefault("STATE_DIR", "state"));
        Path eventLogFile = Path.of("logs/events.jsonl");

        MonitorConfig config = ConfigLoader.load(configDir, env);
        Clock clock = Clock.systemUTC();
        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(
                eventLogFile, config.journal().maxBytes(), config.journal().keepSegments());
        EventCodec.subscribeAll(eventBus, eventStore::append);
        HttpClient httpClient = HttpClientFactory.create(Duration.ofSeconds(10), env);

        MonitorService service = assemble(config, httpClient, eventBus, eventStore, stateDir, clock);
        service.start();
        seedTasks(service, config);

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            service.stop();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static MonitorService assemble(
            MonitorConfig config,
            HttpClient httpClient,
            EventBus eventBus,
            EventStore eventStore,
            Path stateDir,
            Clock clock
    ) {
        TaskRegistry registry = new TaskRegistry(clock, config.minInterval());
        InMemoryDedupStore dedupStore = new InMemoryDedupStore(clock);
        SnapshotCoordinator coordinator = new SnapshotCoordinator(
                registry,
                dedupStore,
                new KeyValueSnapshotStore(new FileKeyValueStore(stateDir)),
                eventBus,
                clock
        );

        Fetcher fetcher = new Fetcher(
                new HttpRawFetcher(httpClient, config.challengeDetector(), config.userAgent(), config.acceptLanguage()),
                rendererFor(config),
                config.challengeDetector(),
                config.retry().toPolicy(),
                Sleeper.SYSTEM
        );
        Notifier notifier = new Notifier(transportFor(config, httpClient), new MessageFormatter(config.zoneId()), eventBus, clock);
        PipelineContext context = new PipelineContext(
                registry,
                dedupStore,
                fetcher,
                notifier,
                enricherFor(config, httpClient, fetcher),
                coordinator,
                eventBus,
                clock,
                new PipelineSettings(config.fetchTimeout(), config.degradedThreshold(), config.dedupScope())
        );
        TaskPipeline pipeline = new TaskPipeline(new ChangeDetector(
                new ContentNormalizer(config.normalization().toRules()),
                new ItemExtractor(config.list().toRules())
        ));
        SchedulerService scheduler = new SchedulerService(
                pipeline, context, coordinator, config.tickInterval(), config.maxConcurrency());
        return new MonitorService(registry, dedupStore, coordinator, scheduler, eventStore,
                config.degradedThreshold(), config.fetchTimeout());
    }

    static NotificationTransport transportFor(MonitorConfig config, HttpClient httpClient) {
        MonitorConfig.TransportSettings transport = config.transport();
        if ("webhook".equals(transport.type())) {
            LOGGER.info("Notifications go to webhook " + transport.webhookUrl());
            return new WebhookTransport(httpClient, URI.create(transport.webhookUrl()), transport.timeout());
        }
        return new LogTransport();
    }

    static RenderedFetcher rendererFor(MonitorConfig config) {
        if (!config.renderer().enabled()) {
            return null;
        }
        LOGGER.info("Rendering fallback enabled: " + String.join(" ", config.renderer().command()));
        return new CommandRenderedFetcher(config.renderer().command(), config.renderer().timeout());
    }

    static ClassificationEnricher enricherFor(MonitorConfig config, HttpClient httpClient, Fetcher fetcher) {
        MonitorConfig.ClassifierSettings classifier = config.classifier();
        if (!classifier.enabled()) {
            return ClassificationEnricher.disabled();
        }
        LOGGER.info("Classification enabled with model " + classifier.model());
        return ClassificationEnricher.enabled(
                new ChatCompletionClassifier(httpClient, classifier.baseUrl(), classifier.apiKey(),
                        classifier.model(), classifier.timeout()),
                fetcher,
                config.fetchTimeout()
        );
    }

    static int seedTasks(MonitorService service, MonitorConfig config) {
        int added = 0;
        for (MonitorConfig.SeedTask seed : config.seedTasks()) {
            boolean present = service.list().stream()
                    .map(TaskView::task)
                    .anyMatch(task -> sameTarget(task, seed));
            if (present) {
                continue;
            }
            Duration interval = seed.interval() == null ? config.minInterval() : seed.interval();
            service.add(seed.url(), seed.mode(), interval, seed.destination());
            added++;
        }
        return added;
    }

    private static boolean sameTarget(MonitorTask task, MonitorConfig.SeedTask seed) {
        return task.url().equals(seed.url() == null ? null : seed.url().trim())
                && task.destination().equals(seed.destination() == null ? null : seed.destination().trim());
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Unable to read bundled logging.properties: " + e.getMessage());
        }
    }
}
