package com.meteoharvest.ingest.pipeline;

import com.meteoharvest.core.error.FetchException;
import com.meteoharvest.core.error.IngestionException;
import com.meteoharvest.core.error.SecretResolutionException;
import com.meteoharvest.core.model.Location;
import com.meteoharvest.core.model.RunOutcome;
import com.meteoharvest.core.model.RunReport;
import com.meteoharvest.core.model.StoredArtifact;
import com.meteoharvest.core.result.Outcome;
import com.meteoharvest.ingest.api.IngestionPipeline;
import com.meteoharvest.ingest.api.PipelineContext;
import com.meteoharvest.ingest.api.SecretResolver;
import com.meteoharvest.ingest.config.PerLocationPipelineConfig;
import com.meteoharvest.ingest.normalize.SnapshotNormalizer;
import com.meteoharvest.ingest.normalize.SnapshotPayload;
import com.meteoharvest.ingest.partition.PartitionKeys;
import com.meteoharvest.ingest.upstream.OpenWeatherClient;
import com.meteoharvest.ingest.upstream.RawSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One upstream call per location, one raw JSON artifact per location and run. Each location is an
 * independent unit of work: its failure is recorded and the remaining locations still run.
 */
public class PerLocationSnapshotPipeline implements IngestionPipeline {
    public static final String NAME = "perLocationSnapshot";
    public static final String EXTENSION = "json";

    private final OpenWeatherClient client;
    private final SecretResolver secretResolver;
    private final SnapshotNormalizer normalizer = new SnapshotNormalizer();
    private final PerLocationPipelineConfig config;
    private final Duration interval;

    public PerLocationSnapshotPipeline(
            OpenWeatherClient client,
            SecretResolver secretResolver,
            PerLocationPipelineConfig config,
            Duration interval
    ) {
        this.client = client;
        this.secretResolver = secretResolver;
        this.config = config;
        this.interval = interval;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Duration interval() {
        return interval;
    }

    @Override
    public RunReport run(PipelineContext ctx) {
        Instant runAt = ctx.clock().instant();
        RunRecorder recorder = new RunRecorder(name(), ctx.eventBus(), ctx.clock(), runAt);
        List<Location> locations = ctx.registry().locations();
        recorder.started(locations.size());

        Outcome<String> resolved = resolveApiKey();
        if (resolved instanceof Outcome.Failure<String> failure) {
            recorder.failure(failure.error());
            return recorder.complete(RunOutcome.TOTAL_FAILURE);
        }
        String apiKey = ((Outcome.Success<String>) resolved).value();

        Instant deadline = runAt.plus(ctx.runTimeout());
        ExecutorService workers = Executors.newFixedThreadPool(Math.min(config.parallelism(), locations.size()));
        try {
            List<Future<Outcome<StoredArtifact>>> units = new ArrayList<>(locations.size());
            for (Location location : locations) {
                units.add(workers.submit(() -> ingestLocation(location, apiKey, runAt, deadline, ctx)));
            }
            for (int i = 0; i < units.size(); i++) {
                Outcome<StoredArtifact> outcome = await(units.get(i), locations.get(i), deadline, ctx);
                if (outcome instanceof Outcome.Success<StoredArtifact> success) {
                    recorder.artifact(success.value());
                } else if (outcome instanceof Outcome.Failure<StoredArtifact> failure) {
                    recorder.failure(failure.error());
                }
            }
        } finally {
            workers.shutdownNow();
        }
        return recorder.complete();
    }

    private Outcome<String> resolveApiKey() {
        try {
            String apiKey = secretResolver.resolve(config.vaultId(), config.secretName());
            if (apiKey == null || apiKey.isBlank()) {
                return Outcome.failure(new SecretResolutionException("Secret " + config.secretName() + " is empty"));
            }
            return Outcome.success(apiKey);
        } catch (SecretResolutionException e) {
            return Outcome.failure(e);
        } catch (RuntimeException e) {
            return Outcome.failure(new SecretResolutionException("Secret store lookup failed for "
                    + config.secretName(), e));
        }
    }

    Outcome<StoredArtifact> ingestLocation(
            Location location,
            String apiKey,
            Instant runAt,
            Instant deadline,
            PipelineContext ctx
    ) {
        if (!ctx.clock().instant().isBefore(deadline)) {
            return Outcome.failure(new FetchException(location.id(), "Location " + location.id()
                    + " not attempted: run deadline " + deadline + " passed"));
        }
        RawSnapshot snapshot;
        try {
            snapshot = client.fetchOne(location, apiKey);
        } catch (IngestionException e) {
            return Outcome.failure(e);
        } catch (RuntimeException e) {
            return Outcome.failure(new FetchException(location.id(), "Fetch failed for " + location.id(), e));
        }
        SnapshotPayload payload = normalizer.normalize(snapshot, runAt);
        String path = PartitionKeys.perLocation(runAt, location, EXTENSION);
        return ctx.writer().write(location.id(), path, payload.body());
    }

    private Outcome<StoredArtifact> await(
            Future<Outcome<StoredArtifact>> unit,
            Location location,
            Instant deadline,
            PipelineContext ctx
    ) {
        long remainingMillis = Math.max(0, Duration.between(ctx.clock().instant(), deadline).toMillis());
        try {
            return unit.get(remainingMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            unit.cancel(true);
            return Outcome.failure(new FetchException(location.id(), "Location " + location.id()
                    + " did not finish before run deadline " + deadline, e));
        } catch (ExecutionException e) {
            return Outcome.failure(new FetchException(location.id(), "Unit failed for " + location.id(), e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            unit.cancel(true);
            return Outcome.failure(new FetchException(location.id(), "Interrupted waiting for " + location.id(), e));
        }
    }
}
