package com.meteoharvest.ingest.pipeline;

import com.meteoharvest.core.error.IngestionException;
import com.meteoharvest.core.events.ArtifactWritten;
import com.meteoharvest.core.events.IngestionRunCompleted;
import com.meteoharvest.core.events.IngestionRunStarted;
import com.meteoharvest.core.events.UnitFailed;
import com.meteoharvest.core.model.RunOutcome;
import com.meteoharvest.core.model.RunReport;
import com.meteoharvest.core.model.RunStage;
import com.meteoharvest.core.model.StoredArtifact;
import com.meteoharvest.core.bus.EventBus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Accumulates the units of one run and emits the matching log lines and events. Only the thread
 * driving the run touches it.
 */
public final class RunRecorder {
    private static final Logger LOGGER = Logger.getLogger(RunRecorder.class.getName());

    private final String pipeline;
    private final EventBus eventBus;
    private final Clock clock;
    private final Instant runAt;
    private final List<StoredArtifact> artifacts = new ArrayList<>();
    private final List<RunReport.UnitFailure> failures = new ArrayList<>();

    public RunRecorder(String pipeline, EventBus eventBus, Clock clock, Instant runAt) {
        this.pipeline = pipeline;
        this.eventBus = eventBus;
        this.clock = clock;
        this.runAt = runAt;
    }

    public void started(int locations) {
        LOGGER.info("ingestion.run.start pipeline=" + pipeline + " runAt=" + runAt + " locations=" + locations);
        eventBus.publish(new IngestionRunStarted(clock.instant(), pipeline, locations));
    }

    public void artifact(StoredArtifact artifact) {
        artifacts.add(artifact);
        LOGGER.info("ingestion.unit pipeline=" + pipeline + " scope=" + artifact.scope() + " status=ok path="
                + artifact.container() + "/" + artifact.path() + " bytes=" + artifact.bytes());
        eventBus.publish(new ArtifactWritten(clock.instant(), pipeline, artifact.scope(), artifact.container(),
                artifact.path(), artifact.bytes()));
    }

    public void failure(IngestionException error) {
        failure(error.scope(), error.stage(), error.rootMessage(), error);
    }

    public void failure(String scope, RunStage stage, String message, Throwable error) {
        failures.add(new RunReport.UnitFailure(scope, stage, message));
        LOGGER.log(Level.WARNING, "ingestion.unit pipeline=" + pipeline + " scope=" + scope + " status=failed stage="
                + stage + " error=" + message, error);
        eventBus.publish(new UnitFailed(clock.instant(), pipeline, scope, stage, message));
    }

    public RunReport complete() {
        return complete(RunOutcome.fromCounts(artifacts.size(), failures.size()));
    }

    public RunReport complete(RunOutcome outcome) {
        long durationMillis = Math.max(0, Duration.between(runAt, clock.instant()).toMillis());
        Level level = switch (outcome) {
            case SUCCESS -> Level.INFO;
            case PARTIAL_FAILURE -> Level.WARNING;
            case TOTAL_FAILURE -> Level.SEVERE;
        };
        LOGGER.log(level, "ingestion.run.end pipeline=" + pipeline + " runAt=" + runAt + " outcome=" + outcome
                + " artifacts=" + artifacts.size() + " failures=" + failures.size() + " durationMillis=" + durationMillis);
        eventBus.publish(new IngestionRunCompleted(clock.instant(), pipeline, outcome, artifacts.size(),
                failures.size(), durationMillis));
        return new RunReport(pipeline, runAt, outcome, artifacts, failures, durationMillis);
    }
}
