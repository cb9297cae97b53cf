package com.meteoharvest.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Terminal summary of one pipeline run.
 */
public record RunReport(
        String pipeline,
        Instant runAt,
        RunOutcome outcome,
        List<StoredArtifact> artifacts,
        List<UnitFailure> failures,
        long durationMillis
) {
    public RunReport {
        Objects.requireNonNull(pipeline, "pipeline is required");
        Objects.requireNonNull(runAt, "runAt is required");
        Objects.requireNonNull(outcome, "outcome is required");
        artifacts = List.copyOf(artifacts);
        failures = List.copyOf(failures);
    }

    public static RunReport totalFailure(String pipeline, Instant runAt, UnitFailure failure, long durationMillis) {
        return new RunReport(pipeline, runAt, RunOutcome.TOTAL_FAILURE, List.of(), List.of(failure), durationMillis);
    }

    public record UnitFailure(String scope, RunStage stage, String message) {
    }
}
