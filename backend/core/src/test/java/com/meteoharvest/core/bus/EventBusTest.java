package com.meteoharvest.core.bus;

import com.meteoharvest.core.events.ArtifactWritten;
import com.meteoharvest.core.events.Event;
import com.meteoharvest.core.events.IngestionRunCompleted;
import com.meteoharvest.core.events.IngestionRunStarted;
import com.meteoharvest.core.events.UnitFailed;
import com.meteoharvest.core.model.RunOutcome;
import com.meteoharvest.core.model.RunStage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventBusTest {
    private static final Instant RUN_AT = Instant.parse("2024-03-01T14:00:00Z");
    private static final String PIPELINE = "perLocationSnapshot";

    @Test
    void partialRunLifecycleReachesEachSubscriberInPublishOrder() {
        EventBus bus = new EventBus();
        List<String> ledger = new ArrayList<>();
        List<UnitFailed> failures = new ArrayList<>();
        List<IngestionRunCompleted> completions = new ArrayList<>();
        bus.subscribe(IngestionRunStarted.class, event -> ledger.add(event.type()));
        bus.subscribe(ArtifactWritten.class, event -> ledger.add(event.type() + ":" + event.scope()));
        bus.subscribe(UnitFailed.class, event -> ledger.add(event.type() + ":" + event.scope()));
        bus.subscribe(UnitFailed.class, failures::add);
        bus.subscribe(IngestionRunCompleted.class, event -> ledger.add(event.type()));
        bus.subscribe(IngestionRunCompleted.class, completions::add);

        publishRun(bus);

        assertEquals(List.of(
                "IngestionRunStarted",
                "ArtifactWritten:rabat",
                "UnitFailed:tanger",
                "IngestionRunCompleted"
        ), ledger);
        assertEquals(RunStage.FETCHING, failures.get(0).stage());
        assertEquals(RunOutcome.PARTIAL_FAILURE, completions.get(0).outcome());
        assertEquals(1, completions.get(0).failures());
    }

    @Test
    void failingLedgerHandlerDoesNotHideRunCompletion() {
        List<String> handlerErrors = new ArrayList<>();
        EventBus bus = new EventBus((event, error) ->
                handlerErrors.add(event.pipeline() + "/" + event.type() + ": " + error.getMessage()));
        List<RunOutcome> outcomes = new ArrayList<>();
        bus.subscribe(IngestionRunCompleted.class, event -> {
            throw new IllegalStateException("ledger disk full");
        });
        bus.subscribe(IngestionRunCompleted.class, event -> outcomes.add(event.outcome()));

        publishRun(bus);

        assertEquals(List.of(RunOutcome.PARTIAL_FAILURE), outcomes);
        assertEquals(List.of("perLocationSnapshot/IngestionRunCompleted: ledger disk full"), handlerErrors);
    }

    @Test
    void eventsWithoutSubscribersAreDropped() {
        List<Event> seen = new ArrayList<>();
        EventBus bus = new EventBus((event, error) -> seen.add(event));

        publishRun(bus);

        assertTrue(seen.isEmpty());
    }

    private static void publishRun(EventBus bus) {
        bus.publish(new IngestionRunStarted(RUN_AT, PIPELINE, 2));
        bus.publish(new ArtifactWritten(RUN_AT.plusSeconds(1), PIPELINE, "rabat", "weather-raw",
                "api-ingestion/Rabat/2024/03/01/14-00_data.json", 512));
        bus.publish(new UnitFailed(RUN_AT.plusSeconds(2), PIPELINE, "tanger", RunStage.FETCHING,
                "Request timed out"));
        bus.publish(new IngestionRunCompleted(RUN_AT.plusSeconds(3), PIPELINE, RunOutcome.PARTIAL_FAILURE, 1, 1, 3000));
    }
}
