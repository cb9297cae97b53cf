package com.meteoharvest.core.events;

import com.meteoharvest.core.model.RunStage;

import java.time.Instant;

public record UnitFailed(
        Instant timestamp,
        String pipeline,
        String scope,
        RunStage stage,
        String message
) implements Event {
    @Override
    public String type() {
        return "UnitFailed";
    }
}
