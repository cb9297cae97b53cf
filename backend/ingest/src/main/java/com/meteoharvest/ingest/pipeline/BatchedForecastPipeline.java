package com.meteoharvest.ingest.pipeline;

import com.meteoharvest.core.error.IngestionException;
import com.meteoharvest.core.error.NormalizationException;
import com.meteoharvest.core.model.Location;
import com.meteoharvest.core.model.ObservationRecord;
import com.meteoharvest.core.model.RunOutcome;
import com.meteoharvest.core.model.RunReport;
import com.meteoharvest.core.model.StoredArtifact;
import com.meteoharvest.core.result.Outcome;
import com.meteoharvest.ingest.api.IngestionPipeline;
import com.meteoharvest.ingest.api.PipelineContext;
import com.meteoharvest.ingest.encode.CsvArtifactEncoder;
import com.meteoharvest.ingest.normalize.ForecastNormalizer;
import com.meteoharvest.ingest.partition.PartitionKeys;
import com.meteoharvest.ingest.upstream.ForecastRequest;
import com.meteoharvest.ingest.upstream.ForecastSeries;
import com.meteoharvest.ingest.upstream.OpenMeteoClient;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.logging.Logger;

/**
 * One upstream call for every location, one combined CSV per run. The upstream call is atomic across
 * locations, so any failure leaves the run without an artifact.
 */
public class BatchedForecastPipeline implements IngestionPipeline {
    public static final String NAME = "batchedForecast";

    private static final Logger LOGGER = Logger.getLogger(BatchedForecastPipeline.class.getName());

    private final OpenMeteoClient client;
    private final ForecastNormalizer normalizer;
    private final CsvArtifactEncoder encoder;
    private final Duration interval;

    public BatchedForecastPipeline(OpenMeteoClient client, Duration interval) {
        this(client, new ForecastNormalizer(), new CsvArtifactEncoder(), interval);
    }

    public BatchedForecastPipeline(
            OpenMeteoClient client,
            ForecastNormalizer normalizer,
            CsvArtifactEncoder encoder,
            Duration interval
    ) {
        this.client = client;
        this.normalizer = normalizer;
        this.encoder = encoder;
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

        String path = PartitionKeys.batched(runAt, CsvArtifactEncoder.EXTENSION);
        Outcome<StoredArtifact> outcome = fetch(locations)
                .flatMap(series -> normalize(series, locations))
                .flatMap(this::encode)
                .flatMap(csv -> ctx.writer().write(IngestionException.BATCH_SCOPE, path, csv));

        if (outcome instanceof Outcome.Failure<StoredArtifact> failure) {
            recorder.failure(failure.error());
            return recorder.complete(RunOutcome.TOTAL_FAILURE);
        }
        recorder.artifact(((Outcome.Success<StoredArtifact>) outcome).value());
        return recorder.complete(RunOutcome.SUCCESS);
    }

    private Outcome<List<ForecastSeries>> fetch(List<Location> locations) {
        try {
            return Outcome.success(client.fetch(ForecastRequest.currentDay(locations)));
        } catch (IngestionException e) {
            return Outcome.failure(e);
        }
    }

    private Outcome<List<ObservationRecord>> normalize(List<ForecastSeries> series, List<Location> locations) {
        try {
            List<ObservationRecord> records = normalizer.normalize(series, locations);
            LOGGER.fine(() -> "ingestion.normalize pipeline=" + NAME + " records=" + records.size());
            return Outcome.success(records);
        } catch (IngestionException e) {
            return Outcome.failure(e);
        }
    }

    private Outcome<byte[]> encode(List<ObservationRecord> records) {
        try {
            return Outcome.success(encoder.encode(records));
        } catch (RuntimeException e) {
            return Outcome.failure(new NormalizationException(IngestionException.BATCH_SCOPE,
                    "Failed encoding " + records.size() + " records as CSV", e));
        }
    }
}
