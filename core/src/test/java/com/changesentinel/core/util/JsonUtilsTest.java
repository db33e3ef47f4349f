package com.changesentinel.core.util;

import com.changesentinel.core.model.Fingerprint;
import com.changesentinel.core.model.MonitorMode;
import com.changesentinel.core.model.MonitorTask;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

class JsonUtilsTest {
    @Test
    void objectMapperIsSingletonAndLenientOnUnknownProperties() {
        ObjectMapper first = JsonUtils.objectMapper();

        assertSame(first, JsonUtils.objectMapper());
        assertFalse(first.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    @Test
    void monitorTaskSerializesTimeAsIsoTextAndOmitsNulls() throws Exception {
        MonitorTask task = MonitorTask.create(
                "a1b2c3d4",
                "https://example.com/notices",
                MonitorMode.LIST,
                Duration.ofMinutes(5),
                "group:42",
                Instant.parse("2026-02-01T00:00:00Z")
        );

        JsonNode tree = JsonUtils.objectMapper().readTree(JsonUtils.toJson(task));

        assertEquals("PT5M", tree.get("interval").asText());
        assertEquals("2026-02-01T00:00:00Z", tree.get("createdAt").asText());
        assertFalse(tree.has("fingerprint"));
        assertFalse(tree.has("nextDue"));
    }

    @Test
    void monitorTaskSurvivesJsonRoundTripWithUnknownFields() throws Exception {
        MonitorTask task = MonitorTask.create(
                "a1b2c3d4",
                "https://example.com/",
                MonitorMode.PAGE,
                Duration.ofSeconds(300),
                "group:42",
                Instant.parse("2026-02-01T00:00:00Z")
        ).recordSuccess(Instant.parse("2026-02-01T00:05:00Z"), new Fingerprint("abc", "Home: hi"), false);

        String json = JsonUtils.toJson(task).replace("{", "{\"legacy\":true,");
        MonitorTask parsed = JsonUtils.objectMapper().readValue(json, MonitorTask.class);

        assertEquals(task, parsed);
    }
}
