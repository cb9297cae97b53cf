package com.meteoharvest.core.events;

import java.time.Instant;

public record IngestionRunStarted(Instant timestamp, String pipeline, int locations) implements Event {
    @Override
    public String type() {
        return "IngestionRunStarted";
    }
}
