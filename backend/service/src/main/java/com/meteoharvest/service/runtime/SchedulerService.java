package com.meteoharvest.service.runtime;

import com.meteoharvest.core.error.IngestionException;
import com.meteoharvest.core.events.IngestionRunCompleted;
import com.meteoharvest.core.events.UnitFailed;
import com.meteoharvest.core.model.RunOutcome;
import com.meteoharvest.core.model.RunReport;
import com.meteoharvest.core.model.RunStage;
import com.meteoharvest.ingest.api.IngestionPipeline;
import com.meteoharvest.ingest.api.PipelineContext;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fires every enabled pipeline at a fixed rate. The timer thread only hands runs to the pipeline
 * executor; {@link #runSafely} keeps any failure from reaching either of them.
 */
public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final List<ScheduledPipeline> pipelines;
    private final PipelineContext context;
    private final Runnable beforeTick;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService pipelineExecutor;

    public SchedulerService(List<ScheduledPipeline> pipelines, PipelineContext context) {
        this(pipelines, context, () -> {
        });
    }

    /**
     * @param beforeTick runs on the timer thread ahead of every tick, e.g. to drop cached upstream responses
     */
    public SchedulerService(List<ScheduledPipeline> pipelines, PipelineContext context, Runnable beforeTick) {
        this(pipelines, context, beforeTick, 1_000);
    }

    SchedulerService(List<ScheduledPipeline> pipelines, PipelineContext context, Runnable beforeTick, long minIntervalMillis) {
        this.pipelines = List.copyOf(pipelines);
        this.context = context;
        this.beforeTick = beforeTick;
        this.minIntervalMillis = minIntervalMillis;
        this.pipelineExecutor = Executors.newFixedThreadPool(Math.max(1, this.pipelines.size()), runThreads());
    }

    /**
     * @param runOnStartup fire immediately, otherwise wait for the top of the next hour
     */
    public void start(boolean runOnStartup) {
        long initialDelayMillis = initialDelayMillis(context.clock().instant(), runOnStartup);
        for (ScheduledPipeline scheduled : pipelines) {
            if (!scheduled.enabled()) {
                LOGGER.info("scheduler.skip pipeline=" + scheduled.pipeline().name() + " reason=disabled");
                continue;
            }
            long intervalMillis = Math.max(minIntervalMillis, scheduled.interval().toMillis());
            timerExecutor.scheduleAtFixedRate(
                    () -> {
                        beforeTick.run();
                        pipelineExecutor.execute(() -> runSafely(scheduled.pipeline()));
                    },
                    initialDelayMillis,
                    intervalMillis,
                    TimeUnit.MILLISECONDS
            );
            LOGGER.info("scheduler.start pipeline=" + scheduled.pipeline().name() + " intervalMillis=" + intervalMillis
                    + " initialDelayMillis=" + initialDelayMillis);
        }
    }

    public List<RunReport> runOnce() {
        beforeTick.run();
        List<RunReport> reports = new ArrayList<>();
        for (ScheduledPipeline scheduled : pipelines) {
            if (scheduled.enabled()) {
                reports.add(runSafely(scheduled.pipeline()));
            }
        }
        return reports;
    }

    public void shutdown() {
        timerExecutor.shutdown();
        pipelineExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            if (!pipelineExecutor.awaitTermination(context.runTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                pipelineExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pipelineExecutor.shutdownNow();
        }
    }

    RunReport runSafely(IngestionPipeline pipeline) {
        Instant runAt = context.clock().instant();
        try {
            return pipeline.run(context);
        } catch (Exception ex) {
            String message = "Pipeline run failed: " + pipeline.name() + " - " + ex.getMessage();
            LOGGER.log(Level.SEVERE, "ingestion.run.end pipeline=" + pipeline.name() + " outcome="
                    + RunOutcome.TOTAL_FAILURE + " error=" + ex, ex);
            long durationMillis = Math.max(0, Duration.between(runAt, context.clock().instant()).toMillis());
            context.eventBus().publish(new UnitFailed(
                    context.clock().instant(),
                    pipeline.name(),
                    IngestionException.BATCH_SCOPE,
                    RunStage.SETUP,
                    message
            ));
            context.eventBus().publish(new IngestionRunCompleted(
                    context.clock().instant(),
                    pipeline.name(),
                    RunOutcome.TOTAL_FAILURE,
                    0,
                    1,
                    durationMillis
            ));
            return RunReport.totalFailure(
                    pipeline.name(),
                    runAt,
                    new RunReport.UnitFailure(IngestionException.BATCH_SCOPE, RunStage.SETUP, message),
                    durationMillis
            );
        }
    }

    /**
     * Runs are handed over with {@code execute}, so an {@link Error} escaping {@link #runSafely} ends up here.
     */
    private static ThreadFactory runThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "ingestion-run-" + counter.incrementAndGet());
            thread.setUncaughtExceptionHandler((t, e) -> LOGGER.log(Level.SEVERE,
                    "scheduler.run.crashed thread=" + t.getName() + " error=" + e, e));
            return thread;
        };
    }

    static long initialDelayMillis(Instant now, boolean runOnStartup) {
        if (runOnStartup) {
            return 0;
        }
        Instant nextHour = now.truncatedTo(ChronoUnit.HOURS).plus(1, ChronoUnit.HOURS);
        return Duration.between(now, nextHour).toMillis();
    }

    public record ScheduledPipeline(IngestionPipeline pipeline, Duration interval, boolean enabled) {
        public ScheduledPipeline {
            Objects.requireNonNull(pipeline, "pipeline is required");
            Objects.requireNonNull(interval, "interval is required");
        }
    }
}
