package com.changesentinel.service;

import com.changesentinel.core.bus.EventBus;
import com.changesentinel.core.model.CheckOutcome;
import com.changesentinel.core.model.MonitorMode;
import com.changesentinel.service.config.ConfigLoader;
import com.changesentinel.service.config.MonitorConfig;
import com.changesentinel.service.notify.LogTransport;
import com.changesentinel.service.notify.WebhookTransport;
import com.changesentinel.service.store.JsonlEventStore;
import com.changesentinel.service.support.HttpFixture;
import com.changesentinel.service.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {
    private static final Instant T0 = Instant.parse("2026-03-01T08:00:00Z");

    @Test
    void assembledServiceChecksARealPageAndPersists() throws Exception {
        Path stateDir = Files.createTempDirectory("main-state-");
        MutableClock clock = new MutableClock(T0, ZoneOffset.UTC);
        HttpClient client = HttpClient.newHttpClient();
        MonitorConfig config = MonitorConfig.defaults();

        try (HttpFixture server = HttpFixture.start("/notices", exchange -> HttpFixture.writeResponse(exchange, 200,
                "<html><head><title>Notices</title></head><body><p>Term starts Monday</p></body></html>"))) {
            MonitorService service = Main.assemble(config, client, new EventBus(),
                    new JsonlEventStore(stateDir.resolve("events.jsonl")), stateDir, clock);
            try {
                String id = service.add(server.url("/notices"), Duration.ofSeconds(60), "chat-1");
                assertEquals(CheckOutcome.BASELINE, service.checkNow(id).outcome());
            } finally {
                service.stop();
            }
        }

        assertTrue(Files.exists(stateDir.resolve("snapshot.json")));
        MonitorService reloaded = Main.assemble(config, client, new EventBus(),
                new JsonlEventStore(stateDir.resolve("events.jsonl")), stateDir, clock);
        try {
            reloaded.start();
            assertEquals(1, reloaded.list().size());
            assertNotNull(reloaded.list().get(0).task().fingerprint());
        } finally {
            reloaded.stop();
        }
    }

    @Test
    void seedTasksAreAddedOnce() throws Exception {
        Path dir = Files.createTempDirectory("main-seed-");
        Files.writeString(dir.resolve(ConfigLoader.FILE_NAME), """
                {
                  "seedTasks": [
                    {"url": "https://example.edu/news", "mode": "LIST", "interval": "PT10M", "destination": "group-1"},
                    {"url": "https://example.edu/about", "destination": "group-1"}
                  ]
                }
                """);
        MonitorConfig config = ConfigLoader.load(dir, Map.of());
        MonitorService service = Main.assemble(config, HttpClient.newHttpClient(), new EventBus(),
                new JsonlEventStore(dir.resolve("events.jsonl")), dir.resolve("state"),
                new MutableClock(T0, ZoneOffset.UTC));
        try {
            assertEquals(2, Main.seedTasks(service, config));
            assertEquals(0, Main.seedTasks(service, config));

            assertEquals(2, service.list().size());
            TaskView news = service.list().get(0);
            assertEquals(MonitorMode.LIST, news.task().mode());
            assertEquals(Duration.ofMinutes(10), news.task().interval());
            assertEquals(Duration.ofSeconds(60), service.list().get(1).task().interval());
        } finally {
            service.stop();
        }
    }

    @Test
    void optionalCapabilitiesFollowTheConfiguration() throws Exception {
        HttpClient client = HttpClient.newHttpClient();
        MonitorConfig defaults = MonitorConfig.defaults();

        assertInstanceOf(LogTransport.class, Main.transportFor(defaults, client));
        assertNull(Main.rendererFor(defaults));
        assertFalse(Main.enricherFor(defaults, client, null).isEnabled());

        Path dir = Files.createTempDirectory("main-capabilities-");
        Files.writeString(dir.resolve(ConfigLoader.FILE_NAME), """
                {
                  "transport": {"type": "webhook", "webhookUrl": "http://127.0.0.1:9/send"},
                  "classifier": {"enabled": true},
                  "renderer": {"enabled": true, "command": ["chromium", "--headless", "--dump-dom", "{url}"]}
                }
                """);
        MonitorConfig configured = ConfigLoader.load(dir, Map.of("CLASSIFIER_API_KEY", "sk-test"));

        assertInstanceOf(WebhookTransport.class, Main.transportFor(configured, client));
        assertNotNull(Main.rendererFor(configured));
        assertTrue(Main.enricherFor(configured, client, null).isEnabled());
    }
}
