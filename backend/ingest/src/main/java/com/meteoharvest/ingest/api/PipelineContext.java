package com.meteoharvest.ingest.api;

import com.meteoharvest.core.bus.EventBus;
import com.meteoharvest.ingest.registry.LocationRegistry;
import com.meteoharvest.ingest.sink.ArtifactWriter;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

public record PipelineContext(
        EventBus eventBus,
        Clock clock,
        LocationRegistry registry,
        ArtifactWriter writer,
        Duration runTimeout
) {
    public PipelineContext {
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(registry, "registry is required");
        Objects.requireNonNull(writer, "writer is required");
        Objects.requireNonNull(runTimeout, "runTimeout is required");
        if (runTimeout.isNegative() || runTimeout.isZero()) {
            throw new IllegalArgumentException("runTimeout must be positive");
        }
    }
}
