package com.meteoharvest.ingest.api;

import com.meteoharvest.core.model.RunReport;

import java.time.Duration;

public interface IngestionPipeline {
    String name();

    Duration interval();

    /**
     * Executes one run. Failures are reported in the returned {@link RunReport}, not thrown.
     */
    RunReport run(PipelineContext ctx);
}
