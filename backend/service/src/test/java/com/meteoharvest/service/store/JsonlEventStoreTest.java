package com.meteoharvest.service.store;

import com.meteoharvest.core.bus.EventBus;
import com.meteoharvest.core.events.Event;
import com.meteoharvest.core.events.IngestionRunCompleted;
import com.meteoharvest.core.events.IngestionRunStarted;
import com.meteoharvest.core.events.UnitFailed;
import com.meteoharvest.core.model.RunOutcome;
import com.meteoharvest.core.model.RunStage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonlEventStoreTest {
    private static final Instant RUN_AT = Instant.parse("2024-03-01T14:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void busEventsAreAppendedAndReloaded() {
        Path file = tempDir.resolve("logs/ingestion-events.jsonl");
        EventBus bus = new EventBus();
        EventCodec.subscribeAll(bus, new JsonlEventStore(file)::append);

        bus.publish(new IngestionRunStarted(RUN_AT, "batchedForecast", 20));
        bus.publish(new IngestionRunCompleted(RUN_AT.plusSeconds(3), "batchedForecast", RunOutcome.SUCCESS, 1, 0, 3000));

        List<Event> events = new JsonlEventStore(file).query(Instant.EPOCH, Optional.empty(), 10);
        assertEquals(2, events.size());
        assertEquals("IngestionRunStarted", events.get(0).type());
        assertEquals("IngestionRunCompleted", events.get(1).type());
    }

    @Test
    void querySupportsSinceTypeAndLimit() {
        JsonlEventStore store = new JsonlEventStore(tempDir.resolve("logs/ingestion-events.jsonl"));
        store.append(new IngestionRunStarted(RUN_AT, "perLocationSnapshot", 6));
        store.append(failure("tanger", RUN_AT.plusSeconds(20)));
        store.append(failure("fes", RUN_AT.plusSeconds(40)));

        assertEquals(2, store.query(RUN_AT.plusSeconds(10), Optional.empty(), 10).size());
        assertEquals(2, store.query(Instant.EPOCH, Optional.of("UnitFailed"), 10).size());
        List<Event> latest = store.query(Instant.EPOCH, Optional.empty(), 1);
        assertEquals(1, latest.size());
        assertEquals("fes", ((UnitFailed) latest.get(0)).scope());
        assertEquals(0, store.query(Instant.EPOCH, Optional.empty(), 0).size());
    }

    @Test
    void missingLedgerQueriesAsEmpty() {
        JsonlEventStore store = new JsonlEventStore(tempDir.resolve("logs/missing.jsonl"));
        assertEquals(0, store.query(Instant.EPOCH, Optional.empty(), 10).size());
    }

    @Test
    void invalidLineFailsWithLineNumber() throws Exception {
        Path file = tempDir.resolve("logs/ingestion-events.jsonl");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "\nnot-json\n", StandardCharsets.UTF_8);

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new JsonlEventStore(file).query(Instant.EPOCH, Optional.empty(), 10));
        assertTrue(ex.getMessage().contains("Invalid JSONL event at line 2"));
    }

    @Test
    void unwritablePathFailsWithClearMessage() throws Exception {
        Path blocker = tempDir.resolve("not-a-dir");
        Files.writeString(blocker, "blocker");

        JsonlEventStore store = new JsonlEventStore(blocker.resolve("events.jsonl"));
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> store.append(failure("rabat", RUN_AT)));
        assertTrue(ex.getMessage().contains("Failed appending UnitFailed"));
    }

    @Test
    void concurrentAppendKeepsEveryLineIntact() throws Exception {
        Path file = tempDir.resolve("logs/ingestion-events.jsonl");
        JsonlEventStore store = new JsonlEventStore(file);

        int total = 200;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            Future<?>[] futures = new Future<?>[total];
            for (int i = 0; i < total; i++) {
                int idx = i;
                futures[i] = executor.submit(() -> store.append(failure("city-" + idx, RUN_AT.plusSeconds(idx))));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(total, lines.size());
        for (String line : lines) {
            EventCodec.fromJsonLine(line);
        }
    }

    private static UnitFailed failure(String scope, Instant at) {
        return new UnitFailed(at, "perLocationSnapshot", scope, RunStage.FETCHING, "timed out");
    }
}
