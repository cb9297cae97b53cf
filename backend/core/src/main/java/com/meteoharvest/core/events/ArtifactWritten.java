package com.meteoharvest.core.events;

import java.time.Instant;

public record ArtifactWritten(
        Instant timestamp,
        String pipeline,
        String scope,
        String container,
        String path,
        long bytes
) implements Event {
    @Override
    public String type() {
        return "ArtifactWritten";
    }
}
