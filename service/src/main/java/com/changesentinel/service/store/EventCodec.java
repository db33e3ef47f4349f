package com.changesentinel.service.store;

import com.changesentinel.core.bus.EventBus;
import com.changesentinel.core.events.AlertRaised;
import com.changesentinel.core.events.ContentChanged;
import com.changesentinel.core.events.Event;
import com.changesentinel.core.events.ItemDiscovered;
import com.changesentinel.core.events.NotificationFailed;
import com.changesentinel.core.events.NotificationSent;
import com.changesentinel.core.events.TaskChecked;
import com.changesentinel.core.events.TaskDegraded;
import com.changesentinel.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.function.Consumer;

public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "TaskChecked", TaskChecked.class,
            "ContentChanged", ContentChanged.class,
            "ItemDiscovered", ItemDiscovered.class,
            "NotificationSent", NotificationSent.class,
            "NotificationFailed", NotificationFailed.class,
            "TaskDegraded", TaskDegraded.class,
            "AlertRaised", AlertRaised.class
    );

    private EventCodec() {
    }

    public static boolean isKnownType(String type) {
        return TYPES.containsKey(type);
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event", e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    public static void subscribeAll(EventBus bus, Consumer<Event> consumer) {
        bus.subscribe(Event.class, consumer::accept);
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
