package com.meteoharvest.service.store;

import com.meteoharvest.core.events.ArtifactWritten;
import com.meteoharvest.core.events.Event;
import com.meteoharvest.core.events.IngestionRunCompleted;
import com.meteoharvest.core.events.UnitFailed;
import com.meteoharvest.core.model.RunOutcome;
import com.meteoharvest.core.model.RunStage;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventCodecTest {
    private static final Instant AT = Instant.parse("2024-03-01T14:00:05Z");

    @Test
    void jsonLineCarriesTypeTimestampAndPayload() {
        String line = EventCodec.toJsonLine(new UnitFailed(AT, "perLocationSnapshot", "tanger", RunStage.FETCHING,
                "Request timed out"));

        assertTrue(line.contains("\"type\":\"UnitFailed\""));
        assertTrue(line.contains("\"timestamp\":\"2024-03-01T14:00:05Z\""));
        assertTrue(line.contains("\"stage\":\"FETCHING\""));
        assertFalse(line.contains("\n"));
    }

    @Test
    void decodesEveryLedgerEventType() {
        Event written = new ArtifactWritten(AT, "batchedForecast", "batch", "weather-raw",
                "ingestion-v2/2024/03/01/weather_1400.csv", 81234);
        Event completed = new IngestionRunCompleted(AT, "batchedForecast", RunOutcome.PARTIAL_FAILURE, 5, 1, 2300);

        assertEquals(written, EventCodec.fromJsonLine(EventCodec.toJsonLine(written)));
        assertEquals(completed, EventCodec.fromJsonLine(EventCodec.toJsonLine(completed)));
    }

    @Test
    void unknownTypeIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> EventCodec.fromJsonLine("{\"type\":\"SiteFetched\",\"event\":{}}"));
    }
}
