package com.meteoharvest.core.events;

import com.meteoharvest.core.model.RunOutcome;

import java.time.Instant;

public record IngestionRunCompleted(
        Instant timestamp,
        String pipeline,
        RunOutcome outcome,
        int artifacts,
        int failures,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "IngestionRunCompleted";
    }
}
