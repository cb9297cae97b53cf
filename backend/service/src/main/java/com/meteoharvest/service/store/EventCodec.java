package com.meteoharvest.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meteoharvest.core.bus.EventBus;
import com.meteoharvest.core.events.ArtifactWritten;
import com.meteoharvest.core.events.Event;
import com.meteoharvest.core.events.IngestionRunCompleted;
import com.meteoharvest.core.events.IngestionRunStarted;
import com.meteoharvest.core.events.UnitFailed;
import com.meteoharvest.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.function.Consumer;

/**
 * One JSON object per line: {@code {"type":..., "timestamp":..., "event":{...}}}.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "IngestionRunStarted", IngestionRunStarted.class,
            "ArtifactWritten", ArtifactWritten.class,
            "UnitFailed", UnitFailed.class,
            "IngestionRunCompleted", IngestionRunCompleted.class
    );

    private EventCodec() {
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event " + event.type(), e);
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
        bus.subscribe(IngestionRunStarted.class, consumer::accept);
        bus.subscribe(ArtifactWritten.class, consumer::accept);
        bus.subscribe(UnitFailed.class, consumer::accept);
        bus.subscribe(IngestionRunCompleted.class, consumer::accept);
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
