package com.meteoharvest.service;

import com.meteoharvest.core.bus.EventBus;
import com.meteoharvest.core.model.RunOutcome;
import com.meteoharvest.core.model.RunReport;
import com.meteoharvest.ingest.api.BlobStore;
import com.meteoharvest.ingest.api.PipelineContext;
import com.meteoharvest.ingest.pipeline.BatchedForecastPipeline;
import com.meteoharvest.ingest.pipeline.PerLocationSnapshotPipeline;
import com.meteoharvest.ingest.registry.LocationRegistry;
import com.meteoharvest.ingest.sink.ArtifactWriter;
import com.meteoharvest.ingest.upstream.HttpFetcher;
import com.meteoharvest.ingest.upstream.OpenMeteoClient;
import com.meteoharvest.ingest.upstream.OpenWeatherClient;
import com.meteoharvest.ingest.upstream.ResponseCache;
import com.meteoharvest.service.config.ConfigLoader;
import com.meteoharvest.service.config.IngestionConfig;
import com.meteoharvest.service.http.HttpClientFactory;
import com.meteoharvest.service.runtime.SchedulerService;
import com.meteoharvest.service.secrets.EnvironmentSecretResolver;
import com.meteoharvest.service.store.EventCodec;
import com.meteoharvest.service.store.FileSystemBlobStore;
import com.meteoharvest.service.store.JsonlEventStore;
import com.meteoharvest.service.store.LazyBlobStore;
import com.meteoharvest.service.store.S3BlobStore;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    private static final int EXIT_STARTUP_FAILURE = 2;

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        RuntimeFlags flags = RuntimeFlags.parse(args);
        Path eventLogFile = Path.of("logs/ingestion-events.jsonl");
        Clock clock = Clock.systemUTC();

        IngestionConfig config;
        LocationRegistry registry;
        HttpClient httpClient;
        try {
            config = ConfigLoader.loadIngestion(flags.configDir());
            registry = ConfigLoader.loadLocations(flags.configDir());
            httpClient = HttpClientFactory.create(config.http().requestTimeout());
        } catch (IllegalStateException e) {
            LOGGER.log(Level.SEVERE, "ingestion.startup.failed configDir=" + flags.configDir() + " error=" + e.getMessage(), e);
            System.exit(EXIT_STARTUP_FAILURE);
            return;
        }

        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(eventLogFile);
        EventCodec.subscribeAll(eventBus, eventStore::append);

        ResponseCache cache = new ResponseCache(config.http().cacheTtl(), clock);
        HttpFetcher fetcher = new HttpFetcher(
                httpClient,
                cache,
                config.http().retry().toPolicy(),
                config.http().requestTimeout(),
                config.http().userAgent()
        );

        PipelineContext context = new PipelineContext(
                eventBus,
                clock,
                registry,
                new ArtifactWriter(blobStore(config.sink()), config.sink().container()),
                config.scheduler().runTimeout()
        );

        SchedulerService scheduler = new SchedulerService(scheduledPipelines(config, fetcher, clock), context, cacheReset(cache));
        LOGGER.info("meteo-harvest starting locations=" + registry.size() + " sink=" + config.sink().type()
                + " container=" + config.sink().container() + " once=" + flags.once());

        if (flags.once()) {
            List<RunReport> reports = scheduler.runOnce();
            scheduler.shutdown();
            int exitCode = exitCode(reports);
            if (exitCode != 0) {
                System.exit(exitCode);
            }
            return;
        }

        scheduler.start(config.scheduler().runOnStartup());
        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("meteo-harvest stopping");
            scheduler.shutdown();
            shutdownLatch.countDown();
        }));
        shutdownLatch.await();
    }

    static List<SchedulerService.ScheduledPipeline> scheduledPipelines(
            IngestionConfig config,
            HttpFetcher fetcher,
            Clock clock
    ) {
        BatchedForecastPipeline batched = new BatchedForecastPipeline(
                new OpenMeteoClient(fetcher, config.batched().endpoint()),
                config.scheduler().interval()
        );
        PerLocationSnapshotPipeline perLocation = new PerLocationSnapshotPipeline(
                new OpenWeatherClient(fetcher, config.perLocation().endpoint(), clock),
                new EnvironmentSecretResolver(),
                config.perLocation(),
                config.scheduler().interval()
        );
        return List.of(
                new SchedulerService.ScheduledPipeline(batched, batched.interval(), config.batched().enabled()),
                new SchedulerService.ScheduledPipeline(perLocation, perLocation.interval(), config.perLocation().enabled())
        );
    }

    /**
     * Responses are cached within one tick only, so every run sees fresh upstream data.
     */
    static Runnable cacheReset(ResponseCache cache) {
        return () -> {
            int dropped = cache.size();
            cache.clear();
            LOGGER.fine(() -> "upstream.cache cleared entries=" + dropped);
        };
    }

    /**
     * The client is only built on the first upload, inside a run.
     */
    static BlobStore blobStore(IngestionConfig.SinkConfig sink) {
        if (IngestionConfig.SinkConfig.S3.equals(sink.type())) {
            return new LazyBlobStore("s3", () -> S3BlobStore.create(sink.endpoint(), sink.region(), sink.bucket()));
        }
        return new LazyBlobStore("filesystem:" + sink.root(), () -> new FileSystemBlobStore(Path.of(sink.root())));
    }

    /**
     * 0 unless some run produced nothing at all.
     */
    static int exitCode(List<RunReport> reports) {
        return reports.stream().anyMatch(report -> report.outcome() == RunOutcome.TOTAL_FAILURE) ? 1 : 0;
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Failed loading bundled logging.properties: " + e.getMessage());
        }
    }

    record RuntimeFlags(boolean once, Path configDir) {
        static RuntimeFlags parse(String[] args) {
            boolean once = false;
            Path configDir = Path.of("config");
            for (String arg : args) {
                if ("--once".equals(arg)) {
                    once = true;
                } else if (arg.startsWith("--config=")) {
                    configDir = Path.of(arg.substring("--config=".length()));
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + arg + " (expected --once, --config=DIR)");
                }
            }
            return new RuntimeFlags(once, configDir);
        }
    }
}
